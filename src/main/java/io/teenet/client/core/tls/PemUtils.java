package io.teenet.client.core.tls;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;

/**
 * PEM utilities for the identity material handed out by the configuration service.
 *
 * <p>grpc-java only accepts unencrypted PKCS#8 keys, while nodes commonly issue SEC1
 * ("BEGIN EC PRIVATE KEY") or PKCS#1 ("BEGIN RSA PRIVATE KEY") keys. Keys are therefore
 * normalized to "BEGIN PRIVATE KEY" before a channel is built. Encrypted PKCS#8 and legacy
 * OpenSSL-encrypted keys are decrypted with the supplied password.
 */
public final class PemUtils {
    private static final BouncyCastleProvider PROVIDER = new BouncyCastleProvider();

    private PemUtils() {}

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static byte[] normalizePrivateKeyToPkcs8Pem(byte[] keyPemBytes, char[] password)
            throws IOException {
        Object parsed = parseFirstKeyObject(keyPemBytes);
        if (parsed == null) {
            throw new IOException("No private key found in PEM data");
        }
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(PROVIDER);
        try {
            if (parsed instanceof PKCS8EncryptedPrivateKeyInfo) {
                requirePassword(password, "Encrypted PKCS#8 private key");
                InputDecryptorProvider decProv =
                        new JceOpenSSLPKCS8DecryptorProviderBuilder()
                                .setProvider(PROVIDER)
                                .build(password);
                PrivateKeyInfo pki =
                        ((PKCS8EncryptedPrivateKeyInfo) parsed).decryptPrivateKeyInfo(decProv);
                return toPem("PRIVATE KEY", pki.getEncoded());
            }
            if (parsed instanceof PEMEncryptedKeyPair) {
                requirePassword(password, "Encrypted private key");
                PEMKeyPair kp =
                        ((PEMEncryptedKeyPair) parsed)
                                .decryptKeyPair(
                                        new JcePEMDecryptorProviderBuilder()
                                                .setProvider(PROVIDER)
                                                .build(password));
                return toPem("PRIVATE KEY", converter.getKeyPair(kp).getPrivate().getEncoded());
            }
            if (parsed instanceof PEMKeyPair) {
                PrivateKey pk = converter.getKeyPair((PEMKeyPair) parsed).getPrivate();
                return toPem("PRIVATE KEY", pk.getEncoded());
            }
            return toPem("PRIVATE KEY", ((PrivateKeyInfo) parsed).getEncoded());
        } catch (OperatorCreationException e) {
            throw new IOException("Unable to decrypt private key: " + e.getMessage(), e);
        } catch (PKCSException e) {
            throw new IOException("Unable to decrypt PKCS#8 private key: " + e.getMessage(), e);
        }
    }

    /** Reads every certificate of a PEM bundle, failing when there is none. */
    public static List<X509Certificate> readCertificates(byte[] certPemBytes) throws IOException {
        List<X509Certificate> certificates = new ArrayList<>();
        JcaX509CertificateConverter converter = new JcaX509CertificateConverter().setProvider(PROVIDER);
        try (PEMParser parser = newParser(certPemBytes)) {
            Object obj;
            while ((obj = parser.readObject()) != null) {
                if (obj instanceof X509CertificateHolder) {
                    certificates.add(converter.getCertificate((X509CertificateHolder) obj));
                }
            }
        } catch (CertificateException e) {
            throw new IOException("Invalid certificate: " + e.getMessage(), e);
        }
        if (certificates.isEmpty()) {
            throw new IOException("No certificate found in PEM data");
        }
        return certificates;
    }

    private static Object parseFirstKeyObject(byte[] pem) throws IOException {
        try (PEMParser parser = newParser(pem)) {
            Object obj;
            while ((obj = parser.readObject()) != null) {
                if (obj instanceof PKCS8EncryptedPrivateKeyInfo
                        || obj instanceof PEMEncryptedKeyPair
                        || obj instanceof PEMKeyPair
                        || obj instanceof PrivateKeyInfo) {
                    return obj;
                }
            }
            return null;
        }
    }

    private static PEMParser newParser(byte[] pem) {
        Reader reader = new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.UTF_8);
        return new PEMParser(reader);
    }

    private static void requirePassword(char[] password, String what) throws IOException {
        if (password == null || password.length == 0) {
            throw new IOException(what + " detected but no password provided");
        }
    }

    private static byte[] toPem(String type, byte[] der) {
        String b64 =
                Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                        .encodeToString(der);
        String s = "-----BEGIN " + type + "-----\n" + b64 + "\n-----END " + type + "-----\n";
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
