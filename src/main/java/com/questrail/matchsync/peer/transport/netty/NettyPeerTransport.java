package com.questrail.matchsync.peer.transport.netty;

import com.questrail.matchsync.peer.transport.ConnectionCodes;
import com.questrail.matchsync.peer.transport.ConnectionState;
import com.questrail.matchsync.peer.transport.PeerRole;
import com.questrail.matchsync.peer.transport.PeerTransport;
import com.questrail.matchsync.peer.transport.PeerTransportException;
import com.questrail.matchsync.peer.transport.PeerTransportListener;
import com.questrail.matchsync.peer.transport.PeerTransportSettings;
import com.questrail.matchsync.peer.transport.RendezvousDirectory;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * NettyPeerTransport
 * =============================================================================
 * Netty-backed implementation of the {@link PeerTransport} port over TCP.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse
 * sync messages, track sync operations, or schedule retries of its own.
 *
 * <h2>Wire framing</h2>
 * Every message is a 4-byte big-endian length followed by that many bytes of
 * UTF-8 text. Frames larger than {@link PeerTransportSettings#maxFrameBytes()}
 * close the channel.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) MUST NOT
 * escape this package. Listeners only ever see {@link String}s and
 * {@link ConnectionState}s.
 *
 * <h2>Threading</h2>
 * {@link #hostSession()} and {@link #joinSession(String)} block the calling
 * thread until the endpoint opens or fails; never call them from a listener
 * callback. Listener callbacks run on Netty I/O threads.
 *
 * <h2>Session generations</h2>
 * Each host/join/disconnect starts a new generation. Channel callbacks from an
 * older generation are ignored so a late close cannot clobber the state of the
 * session that replaced it.
 */
public final class NettyPeerTransport implements PeerTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyPeerTransport.class);

    private final RendezvousDirectory directory;
    private final InetAddress bindHost;
    private final InetAddress advertiseHost;
    private final PeerTransportSettings settings;
    private final Random random;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup channels;
    private final List<PeerTransportListener> listeners = new CopyOnWriteArrayList<>();

    private final Object stateLock = new Object();
    private ConnectionState state = ConnectionState.idle();
    private Channel serverChannel;
    private String publishedCode;
    private long generation;
    private volatile boolean closed;

    /**
     * @param directory     rendezvous used to publish and resolve codes
     * @param bindHost      local interface to listen on when hosting
     * @param advertiseHost address published for joiners; {@code null} means {@code bindHost}
     * @param settings      timeouts and limits
     * @param random        code source (a {@code SecureRandom} in production)
     */
    public NettyPeerTransport(RendezvousDirectory directory,
                              InetAddress bindHost,
                              InetAddress advertiseHost,
                              PeerTransportSettings settings,
                              Random random)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.bindHost = Objects.requireNonNull(bindHost, "bindHost");
        this.advertiseHost = advertiseHost != null ? advertiseHost : bindHost;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.random = Objects.requireNonNull(random, "random");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.channels = new DefaultChannelGroup("matchsync-peers", GlobalEventExecutor.INSTANCE);
    }

    // -------------------------------------------------------------------------
    // PeerTransport
    // -------------------------------------------------------------------------

    @Override
    public String hostSession()
    {
        ensureOpen();
        long session = resetSession();
        String firstCode = ConnectionCodes.generate(random);
        updateState(s -> s.opening(PeerRole.HOST, firstCode));

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new PeerChannelInitializer(session));

        ChannelFuture bind = bootstrap.bind(new InetSocketAddress(bindHost, 0));
        if (!bind.awaitUninterruptibly(settings.initTimeout().toMillis())) {
            bind.cancel(false);
            bind.addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    f.channel().close();
                }
            });
            throw fail(PeerTransportException.Kind.INIT_TIMEOUT,
                    "Failed to initialize as host: endpoint did not open in time", null);
        }
        if (!bind.isSuccess()) {
            throw fail(PeerTransportException.Kind.INIT_FAILED,
                    "Failed to initialize as host: " + describe(bind.cause()), bind.cause());
        }

        Channel server = bind.channel();
        int port = ((InetSocketAddress) server.localAddress()).getPort();
        InetSocketAddress published = new InetSocketAddress(advertiseHost, port);

        String code = firstCode;
        int attempt = 1;
        while (!directory.register(code, published)) {
            if (attempt >= settings.maxCodeAttempts()) {
                server.close();
                throw fail(PeerTransportException.Kind.CODE_COLLISION,
                        "Failed to initialize as host: no free connection code after " + attempt + " attempts", null);
            }
            log.debug("Connection code {} already in use, generating a new one", code);
            code = ConnectionCodes.generate(random);
            attempt++;
        }

        synchronized (stateLock) {
            serverChannel = server;
            publishedCode = code;
        }
        final String finalCode = code;
        updateState(s -> s.withCode(finalCode));
        log.info("Hosting peer session {} on {}", code, published);
        return code;
    }

    @Override
    public void joinSession(String code)
    {
        ensureOpen();
        String normalized = ConnectionCodes.normalize(code);
        long session = resetSession();
        updateState(s -> s.opening(PeerRole.JOINER, normalized));

        InetSocketAddress host = directory.resolve(normalized)
                .orElseThrow(() -> fail(PeerTransportException.Kind.PEER_UNAVAILABLE,
                        "Connection error: The connection code is invalid or the host is no longer available", null));

        long timeoutMillis = settings.connectTimeout().toMillis();
        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                .handler(new PeerChannelInitializer(session));

        ChannelFuture connect = bootstrap.connect(host);
        if (!connect.awaitUninterruptibly(timeoutMillis)) {
            connect.cancel(false);
            throw fail(PeerTransportException.Kind.TIMEOUT, "Connection timed out. Please try again.", null);
        }
        if (!connect.isSuccess()) {
            Throwable cause = connect.cause();
            if (cause instanceof ConnectTimeoutException) {
                throw fail(PeerTransportException.Kind.TIMEOUT, "Connection timed out. Please try again.", cause);
            }
            throw fail(PeerTransportException.Kind.PEER_UNAVAILABLE,
                    "Connection error: The connection code is invalid or the host is no longer available", cause);
        }

        onChannelOpened(session, connect.channel());
        log.info("Joined peer session {} at {}", normalized, host);
    }

    @Override
    public boolean send(String message)
    {
        Objects.requireNonNull(message, "message");
        if (channels.isEmpty()) {
            updateState(s -> s.withError("Cannot send data: not connected to any peers"));
            return false;
        }
        channels.writeAndFlush(message);
        return true;
    }

    @Override
    public void addListener(PeerTransportListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(PeerTransportListener listener)
    {
        listeners.remove(listener);
    }

    @Override
    public void disconnect()
    {
        resetSession();
        updateState(s -> ConnectionState.idle());
    }

    @Override
    public ConnectionState getState()
    {
        synchronized (stateLock) {
            return state;
        }
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        disconnect();
        bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void ensureOpen()
    {
        if (closed) {
            throw new IllegalStateException("transport is closed");
        }
    }

    /**
     * Close everything belonging to the current session and start a new generation.
     */
    private long resetSession()
    {
        Channel server;
        String code;
        long next;
        synchronized (stateLock) {
            server = serverChannel;
            code = publishedCode;
            serverChannel = null;
            publishedCode = null;
            next = ++generation;
        }
        if (code != null) {
            directory.unregister(code);
        }
        if (server != null) {
            server.close();
        }
        channels.close();
        return next;
    }

    private boolean isCurrent(long session)
    {
        synchronized (stateLock) {
            return session == generation;
        }
    }

    private void onChannelOpened(long session, Channel channel)
    {
        if (!isCurrent(session)) {
            channel.close();
            return;
        }
        channels.add(channel);
        updateState(s -> s.withPeerCount(channels.size()));
    }

    private void onChannelClosed(long session, Channel channel)
    {
        channels.remove(channel);
        if (isCurrent(session)) {
            updateState(s -> s.withPeerCount(channels.size()));
        }
    }

    private PeerTransportException fail(PeerTransportException.Kind kind, String message, Throwable cause)
    {
        log.warn("{} ({})", message, kind);
        updateState(s -> s.withError(message));
        return new PeerTransportException(kind, message, cause);
    }

    private void updateState(UnaryOperator<ConnectionState> change)
    {
        ConnectionState updated;
        synchronized (stateLock) {
            updated = change.apply(state);
            if (updated.equals(state)) {
                return;
            }
            state = updated;
        }
        for (PeerTransportListener l : listeners) {
            try {
                l.onStateChanged(updated);
            } catch (RuntimeException e) {
                log.error("Connection state listener failed", e);
            }
        }
    }

    private void deliver(String message)
    {
        for (PeerTransportListener l : listeners) {
            try {
                l.onMessage(message);
            } catch (RuntimeException e) {
                log.error("Peer message listener failed", e);
            }
        }
    }

    private static String describe(Throwable t)
    {
        if (t == null) {
            return "Unknown error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * Installs framing, UTF-8 text codecs and the inbound handler.
     */
    private final class PeerChannelInitializer extends ChannelInitializer<SocketChannel>
    {
        private final long session;

        private PeerChannelInitializer(long session)
        {
            this.session = session;
        }

        @Override
        protected void initChannel(SocketChannel ch)
        {
            ChannelPipeline p = ch.pipeline();
            p.addLast(new LengthFieldBasedFrameDecoder(settings.maxFrameBytes(), 0, 4, 0, 4));
            p.addLast(new LengthFieldPrepender(4));
            p.addLast(new StringDecoder(StandardCharsets.UTF_8));
            p.addLast(new StringEncoder(StandardCharsets.UTF_8));
            p.addLast(new InboundHandler(session));
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Tracks channel lifecycle and forwards decoded text to the listeners.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        private final long session;

        private InboundHandler(long session)
        {
            this.session = session;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            onChannelOpened(session, ctx.channel());
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String message)
        {
            if (isCurrent(session)) {
                deliver(message);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            log.debug("Peer channel {} closed", ctx.channel().remoteAddress());
            onChannelClosed(session, ctx.channel());
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (isCurrent(session)) {
                String message = "Connection error with peer " + ctx.channel().remoteAddress() + ": " + describe(cause);
                log.warn(message, cause);
                updateState(s -> s.withError(message));
            }
            ctx.close();
        }
    }
}
