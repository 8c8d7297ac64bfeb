package io.teenet.client.core.task;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.protobuf.ByteString;

import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;

import io.teenet.client.core.config.ChannelSettings;
import io.teenet.client.core.config.NodeConfig;
import io.teenet.client.core.grpc.AuthenticatedClient;
import io.teenet.client.core.grpc.ChannelFactory;
import io.teenet.client.core.grpc.InProcessChannelFactory;
import io.teenet.client.core.grpc.RetryPolicy;
import io.teenet.client.core.tls.CertificateFixtures;
import io.teenet.client.exception.ConnectionException;
import io.teenet.client.exception.NotConnectedException;
import io.teenet.client.exception.SigningException;
import io.teenet.client.exception.TransportException;
import io.teenet.client.proto.keymanagement.SignRequest;
import io.teenet.client.proto.keymanagement.SignResponse;
import io.teenet.client.proto.keymanagement.UserTaskGrpc;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class TaskClientTest {
    private static final byte[] MESSAGE = "hello".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PUBLIC_KEY = {0x02, 0x11, 0x22, 0x33};
    private static final byte[] SIGNATURE = {0x30, 0x44, 0x01};

    private CertificateFixtures nodeIdentity;
    private CertificateFixtures teeIdentity;

    private String address;
    private Server server;
    private FakeUserTaskService service;
    private InProcessChannelFactory channelFactory;
    private TaskClient client;

    @BeforeClass
    public void generateCertificates() throws Exception {
        nodeIdentity = CertificateFixtures.generate("app-node");
        teeIdentity = CertificateFixtures.generate("tee-node");
    }

    @BeforeMethod
    public void setUp() throws Exception {
        address = InProcessChannelFactory.nextAddress();
        service = new FakeUserTaskService();
        server =
                InProcessServerBuilder.forName(address)
                        .directExecutor()
                        .addService(service)
                        .build()
                        .start();
        channelFactory = new InProcessChannelFactory();
        client = newClient(nodeConfig(address), channelFactory);
    }

    @AfterMethod
    public void tearDown() throws InterruptedException {
        client.close();
        server.shutdownNow();
        server.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    public void signBeforeConnectFailsWithoutNetwork() {
        ChannelFactory factory = mock(ChannelFactory.class);
        TaskClient unconnected = newClient(nodeConfig(address), factory);

        Assert.assertEquals(unconnected.getState(), AuthenticatedClient.State.UNCONNECTED);
        Assert.expectThrows(
                NotConnectedException.class,
                () -> unconnected.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
        verifyNoInteractions(factory);
        Assert.assertEquals(service.attempts.get(), 0);
    }

    @Test
    public void rejectsEmptyArgumentsBeforeAnyCall() {
        client.connect(Context.current());

        Assert.expectThrows(
                IllegalArgumentException.class,
                () -> client.sign(Context.current(), new byte[0], PUBLIC_KEY, 2, 1));
        Assert.expectThrows(
                IllegalArgumentException.class,
                () -> client.sign(Context.current(), MESSAGE, new byte[0], 2, 1));
        Assert.expectThrows(
                IllegalArgumentException.class,
                () -> client.sign(Context.current(), null, PUBLIC_KEY, 2, 1));
        Assert.assertEquals(service.attempts.get(), 0);
    }

    @Test
    public void emptyArgumentsWinOverMissingConnection() {
        Assert.expectThrows(
                IllegalArgumentException.class,
                () -> client.sign(Context.current(), MESSAGE, null, 2, 1));
    }

    @Test
    public void signsAndForwardsRequestFields() {
        service.enqueue(success(SIGNATURE));
        client.connect(Context.current());

        byte[] signature =
                client.sign(MESSAGE, PUBLIC_KEY, SignProtocol.ECDSA, Curve.SECP256K1);

        Assert.assertEquals(signature, SIGNATURE);
        SignRequest request = service.lastRequest.get();
        Assert.assertEquals(request.getFrom(), 42);
        Assert.assertEquals(request.getMsg().toByteArray(), MESSAGE);
        Assert.assertEquals(request.getPublicKeyInfo().toByteArray(), PUBLIC_KEY);
        Assert.assertEquals(request.getProtocol(), 1);
        Assert.assertEquals(request.getCurve(), 2);
    }

    @Test
    public void signsWithOversizedTimeout() {
        service.enqueue(success(SIGNATURE));
        client.setTimeout(Duration.ofSeconds(Long.MAX_VALUE));
        client.connect(Context.current());

        Assert.assertEquals(client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1), SIGNATURE);
    }

    @Test
    public void unsuccessfulResponseRaisesSigningError() {
        service.enqueue(
                SignResponse.newBuilder()
                        .setSuccess(false)
                        .setError("key not found")
                        .setSignature(ByteString.copyFrom(SIGNATURE))
                        .build());
        client.connect(Context.current());

        SigningException e =
                Assert.expectThrows(
                        SigningException.class,
                        () -> client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
        Assert.assertEquals(e.getServerError(), "key not found");
        Assert.assertEquals(e.getMessage(), "signing failed: key not found");
    }

    @Test
    public void unsuccessfulResponseWithoutErrorIsStillReported() {
        service.enqueue(SignResponse.newBuilder().setSuccess(false).build());
        client.connect(Context.current());

        SigningException e =
                Assert.expectThrows(
                        SigningException.class,
                        () -> client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
        Assert.assertEquals(e.getServerError(), "unknown error");
    }

    @Test
    public void retriesUnavailableUntilSuccess() {
        service.enqueue(Status.UNAVAILABLE);
        service.enqueue(Status.UNAVAILABLE);
        service.enqueue(success(SIGNATURE));
        client.connect(Context.current());

        byte[] signature = client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1);

        Assert.assertEquals(signature, SIGNATURE);
        Assert.assertEquals(service.attempts.get(), 3);
    }

    @Test
    public void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 4; i++) {
            service.enqueue(Status.UNAVAILABLE.withDescription("busy"));
        }
        client.connect(Context.current());

        TransportException e =
                Assert.expectThrows(
                        TransportException.class,
                        () -> client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
        Assert.assertEquals(e.getCode(), Status.Code.UNAVAILABLE);
        Assert.assertEquals(service.attempts.get(), 3);
    }

    @Test
    public void nonRetryableStatusFailsOnFirstAttempt() {
        service.enqueue(Status.INVALID_ARGUMENT.withDescription("bad curve"));
        service.enqueue(success(SIGNATURE));
        client.connect(Context.current());

        TransportException e =
                Assert.expectThrows(
                        TransportException.class,
                        () -> client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 9));
        Assert.assertEquals(e.getCode(), Status.Code.INVALID_ARGUMENT);
        Assert.assertEquals(e.getStatus().getDescription(), "bad curve");
        Assert.assertEquals(service.attempts.get(), 1);
    }

    @Test
    public void singleAttemptPolicyDoesNotRetry() {
        service.enqueue(Status.UNAVAILABLE);
        service.enqueue(success(SIGNATURE));
        TaskClient noRetry =
                new TaskClient(
                        nodeConfig(address), channelFactory, ChannelSettings.defaults(), RetryPolicy.none());
        noRetry.connect(Context.current());
        try {
            Assert.expectThrows(
                    TransportException.class,
                    () -> noRetry.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
            Assert.assertEquals(service.attempts.get(), 1);
        } finally {
            noRetry.close();
        }
    }

    @Test
    public void signsFromOtherThreadsAfterConnect() throws Exception {
        for (int i = 0; i < 4; i++) {
            service.enqueue(success(SIGNATURE));
        }
        client.connect(Context.current());
        ExecutorService workers = Executors.newFixedThreadPool(4);
        try {
            List<Future<byte[]>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                results.add(
                        workers.submit(() -> client.sign(Context.ROOT, MESSAGE, PUBLIC_KEY, 2, 1)));
            }
            for (Future<byte[]> result : results) {
                Assert.assertEquals(result.get(5, TimeUnit.SECONDS), SIGNATURE);
            }
        } finally {
            workers.shutdownNow();
        }
        Assert.assertEquals(service.attempts.get(), 4);
    }

    @Test
    public void cancellingParentContextAbortsPromptly() {
        service.hang = true;
        client.connect(Context.current());
        Context.CancellableContext parent = Context.current().withCancellation();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> parent.cancel(null), 200, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();

            TransportException e =
                    Assert.expectThrows(
                            TransportException.class,
                            () -> client.sign(parent, MESSAGE, PUBLIC_KEY, 2, 1));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            Assert.assertEquals(e.getCode(), Status.Code.CANCELLED);
            Assert.assertTrue(elapsedMillis < 5000, "took " + elapsedMillis + " ms");
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    public void appliesConfiguredTimeout() {
        service.hang = true;
        client.setTimeout(Duration.ofMillis(300));
        client.connect(Context.current());

        TransportException e =
                Assert.expectThrows(
                        TransportException.class,
                        () -> client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
        Assert.assertEquals(e.getCode(), Status.Code.DEADLINE_EXCEEDED);
        Assert.assertEquals(client.getTimeout(), Duration.ofMillis(300));
    }

    @Test
    public void closeIsIdempotent() {
        client.close();
        client.close();
        Assert.assertEquals(client.getState(), AuthenticatedClient.State.UNCONNECTED);

        client.connect(Context.current());
        Assert.assertTrue(client.isConnected());
        client.close();
        client.close();
        Assert.assertEquals(client.getState(), AuthenticatedClient.State.CLOSED);
        Assert.assertTrue(channelFactory.allChannelsShutdown());
        Assert.expectThrows(
                NotConnectedException.class,
                () -> client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1));
    }

    @Test
    public void reconnectReplacesPreviousChannel() {
        service.enqueue(success(SIGNATURE));
        client.connect(Context.current());
        ManagedChannel first = channelFactory.getChannels().get(0);

        client.connect(Context.current());

        Assert.assertEquals(channelFactory.getChannels().size(), 2);
        Assert.assertTrue(first.isShutdown());
        Assert.assertFalse(channelFactory.getChannels().get(1).isShutdown());
        Assert.assertEquals(client.sign(Context.current(), MESSAGE, PUBLIC_KEY, 2, 1), SIGNATURE);
    }

    @Test
    public void connectWithoutTrustedExecutionPeerFails() {
        NodeConfig noTee = nodeConfig(address).toBuilder().rpcAddress("").build();
        TaskClient orphan = newClient(noTee, channelFactory);

        Assert.expectThrows(ConnectionException.class, () -> orphan.connect(Context.current()));
        Assert.assertEquals(orphan.getState(), AuthenticatedClient.State.UNCONNECTED);
    }

    @Test
    public void connectWithBrokenCertificateLeavesClientUnconnected() {
        NodeConfig broken =
                nodeConfig(address).toBuilder()
                        .targetCert(ByteString.copyFromUtf8("garbage"))
                        .build();
        TaskClient brokenClient = newClient(broken, channelFactory);

        ConnectionException e =
                Assert.expectThrows(
                        ConnectionException.class, () -> brokenClient.connect(Context.current()));
        Assert.assertTrue(e.getMessage().startsWith("failed to connect to TEE server"), e.getMessage());
        Assert.assertFalse(brokenClient.isConnected());
    }

    @Test
    public void connectWithCancelledContextFails() {
        Context.CancellableContext cancelled = Context.current().withCancellation();
        cancelled.cancel(null);

        Assert.expectThrows(ConnectionException.class, () -> client.connect(cancelled));
        Assert.assertTrue(channelFactory.getChannels().isEmpty());
    }

    private TaskClient newClient(NodeConfig config, ChannelFactory factory) {
        return new TaskClient(config, factory, ChannelSettings.defaults(), RetryPolicy.defaults());
    }

    private NodeConfig nodeConfig(String teeAddress) {
        try {
            return NodeConfig.builder()
                    .nodeId(42)
                    .cert(nodeIdentity.certPem())
                    .key(nodeIdentity.sec1KeyPem())
                    .rpcAddress(teeAddress)
                    .targetCert(teeIdentity.certPem())
                    .build();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static SignResponse success(byte[] signature) {
        return SignResponse.newBuilder()
                .setSuccess(true)
                .setSignature(ByteString.copyFrom(signature))
                .build();
    }

    /** Replies from a queue of scripted outcomes: a response or a failure status. */
    static class FakeUserTaskService extends UserTaskGrpc.UserTaskImplBase {
        final AtomicInteger attempts = new AtomicInteger();
        final AtomicReference<SignRequest> lastRequest = new AtomicReference<>();
        private final Deque<Object> outcomes = new ArrayDeque<>();
        volatile boolean hang;

        synchronized void enqueue(Object outcome) {
            outcomes.add(outcome);
        }

        @Override
        public void sign(SignRequest request, StreamObserver<SignResponse> responseObserver) {
            attempts.incrementAndGet();
            lastRequest.set(request);
            if (hang) {
                return;
            }
            Object outcome;
            synchronized (this) {
                outcome = outcomes.poll();
            }
            if (outcome instanceof Status) {
                responseObserver.onError(((Status) outcome).asRuntimeException());
                return;
            }
            if (outcome == null) {
                responseObserver.onError(Status.INTERNAL.withDescription("no outcome").asRuntimeException());
                return;
            }
            responseObserver.onNext((SignResponse) outcome);
            responseObserver.onCompleted();
        }
    }
}
