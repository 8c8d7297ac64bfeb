package io.teenet.client.core.appid;

import com.google.common.base.Preconditions;

import io.grpc.Context;

import io.teenet.client.core.config.ChannelSettings;
import io.teenet.client.core.config.ClientConstants;
import io.teenet.client.core.grpc.AuthenticatedClient;
import io.teenet.client.core.grpc.ChannelFactory;
import io.teenet.client.core.grpc.RetryPolicy;
import io.teenet.client.core.tls.PemUtils;
import io.teenet.client.proto.appid.AppIDServiceGrpc;
import io.teenet.client.proto.appid.GetPublicKeyByAppIDRequest;
import io.teenet.client.proto.appid.GetPublicKeyByAppIDResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Looks up application public keys on the application node over mTLS. */
public class AppIdClient extends AuthenticatedClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(AppIdClient.class);

    public AppIdClient(String serverAddress) {
        this(serverAddress, ChannelFactory.create(), ChannelSettings.defaults(), RetryPolicy.defaults());
    }

    public AppIdClient(
            String serverAddress,
            ChannelFactory channelFactory,
            ChannelSettings settings,
            RetryPolicy retryPolicy) {
        super(
                "user management service",
                serverAddress,
                AppIDServiceGrpc.SERVICE_NAME,
                ClientConstants.DEFAULT_CLIENT_TIMEOUT,
                channelFactory,
                settings,
                retryPolicy);
    }

    public AppPublicKey getPublicKey(String appId) {
        return getPublicKey(Context.current(), appId);
    }

    public AppPublicKey getPublicKey(Context context, String appId) {
        Preconditions.checkArgument(!PemUtils.isBlank(appId), "app id cannot be empty");
        AppIDServiceGrpc.AppIDServiceBlockingStub stub =
                AppIDServiceGrpc.newBlockingStub(requireChannel());
        GetPublicKeyByAppIDRequest request =
                GetPublicKeyByAppIDRequest.newBuilder().setAppId(appId).build();

        GetPublicKeyByAppIDResponse response =
                invoke(
                        context,
                        "GetPublicKeyByAppID",
                        deadline -> stub.withDeadline(deadline).getPublicKeyByAppID(request));
        LOGGER.debug(
                "[AppId] Resolved key for app {} protocol={} curve={}",
                appId,
                response.getProtocol(),
                response.getCurve());
        return AppPublicKey.builder()
                .publicKey(response.getPublickey())
                .protocol(response.getProtocol())
                .curve(response.getCurve())
                .build();
    }
}
