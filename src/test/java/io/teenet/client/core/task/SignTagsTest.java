package io.teenet.client.core.task;

import org.testng.Assert;
import org.testng.annotations.Test;

public class SignTagsTest {

    @Test
    public void protocolCodesMatchWireValues() {
        Assert.assertEquals(SignProtocol.ECDSA.getCode(), 1);
        Assert.assertEquals(SignProtocol.SCHNORR.getCode(), 2);
        Assert.assertEquals(Curve.ED25519.getCode(), 1);
        Assert.assertEquals(Curve.SECP256K1.getCode(), 2);
        Assert.assertEquals(Curve.SECP256R1.getCode(), 3);
    }

    @Test
    public void parsesProtocolNames() {
        Assert.assertEquals(SignProtocol.codeOf("ecdsa"), 1);
        Assert.assertEquals(SignProtocol.codeOf("Schnorr"), 2);
        Assert.assertEquals(SignProtocol.codeOf(" ECDSA "), 1);
        Assert.assertEquals(SignProtocol.codeOf("7"), 7);
    }

    @Test
    public void unknownProtocolFallsBackToSchnorr() {
        Assert.assertEquals(SignProtocol.codeOf("bls"), 2);
        Assert.assertEquals(SignProtocol.codeOf(""), 2);
        Assert.assertEquals(SignProtocol.codeOf(null), 2);
        Assert.assertEquals(SignProtocol.codeOf("-1"), 2);
    }

    @Test
    public void parsesCurveNames() {
        Assert.assertEquals(Curve.codeOf("ed25519"), 1);
        Assert.assertEquals(Curve.codeOf("secp256k1"), 2);
        Assert.assertEquals(Curve.codeOf("SECP256R1"), 3);
        Assert.assertEquals(Curve.codeOf("4"), 4);
    }

    @Test
    public void unknownCurveFallsBackToEd25519() {
        Assert.assertEquals(Curve.codeOf("p384"), 1);
        Assert.assertEquals(Curve.codeOf(null), 1);
    }
}
