package com.questrail.guider.protocol.phd2.transport.tcp.netty;

import com.questrail.guider.protocol.phd2.transport.StreamConnection;
import com.questrail.guider.protocol.phd2.transport.StreamConnector;
import com.questrail.guider.protocol.phd2.transport.StreamListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamConnector
 * =============================================================================
 * Netty-backed implementation of the {@link StreamConnector} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse JSON or classify messages</li>
 *   <li>Correlate requests and responses</li>
 *   <li>Schedule retries, reconnects, or timeouts</li>
 * </ul>
 *
 * <h2>Framing</h2>
 * Inbound bytes are split on LF / CRLF by a {@link LineBasedFrameDecoder}.
 * Partial reads are buffered until a full line exists. A line longer than the
 * configured limit is discarded up to the next terminator and reported through
 * {@link StreamListener#onFramingError(String)}; the connection stays up.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound lines are copied into {@code byte[]}
 * before reaching the listener.
 *
 * <h2>Lifecycle</h2>
 * The connector owns one {@link NioEventLoopGroup} shared by every connection
 * it opens. {@link #shutdown()} releases it.
 */
public final class NettyTcpStreamConnector implements StreamConnector
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamConnector.class);

    private final int maxFrameLength;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyTcpStreamConnector(int maxFrameLength)
    {
        if (maxFrameLength < 1) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        this.maxFrameLength = maxFrameLength;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true);
    }

    @Override
    public CompletableFuture<StreamConnection> connect(InetSocketAddress remote, Duration timeout, StreamListener listener)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(listener, "listener");

        CompletableFuture<StreamConnection> result = new CompletableFuture<>();
        NettyStreamConnection connection = new NettyStreamConnection(remote, listener);

        Bootstrap b = bootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis(timeout))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(maxFrameLength, true, false));
                        p.addLast(connection.new InboundHandler());
                    }
                });

        ChannelFuture f = b.connect(remote);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                connection.channel = future.channel();
                result.complete(connection);
            }
            else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    @Override
    public boolean canConnect(InetSocketAddress remote, Duration timeout)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(timeout, "timeout");

        Bootstrap b = bootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis(timeout))
                .handler(new ChannelInboundHandlerAdapter());

        ChannelFuture f = b.connect(remote);
        boolean completed = f.awaitUninterruptibly(timeout.toMillis() + 100, TimeUnit.MILLISECONDS);
        if (completed && f.isSuccess()) {
            f.channel().close();
            return true;
        }
        if (!completed) {
            f.cancel(false);
        }
        return false;
    }

    /**
     * Release the event loop group. Open connections are closed.
     */
    public void shutdown()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    private static int timeoutMillis(Duration timeout)
    {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    /**
     * Connection handle plus the inbound handler bound to its channel.
     */
    private static final class NettyStreamConnection implements StreamConnection
    {
        private final InetSocketAddress remote;
        private final StreamListener listener;
        private final AtomicBoolean closeNotified = new AtomicBoolean(false);

        private volatile Channel channel;
        private volatile Throwable failure;

        NettyStreamConnection(InetSocketAddress remote, StreamListener listener)
        {
            this.remote = remote;
            this.listener = listener;
        }

        @Override
        public CompletableFuture<Void> send(byte[] line)
        {
            Objects.requireNonNull(line, "line");

            Channel ch = channel;
            if (ch == null || !ch.isActive()) {
                return CompletableFuture.failedFuture(new IllegalStateException("Connection is not open"));
            }

            CompletableFuture<Void> written = new CompletableFuture<>();
            ByteBuf buf = Unpooled.wrappedBuffer(line);
            ch.writeAndFlush(buf).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    written.complete(null);
                }
                else {
                    written.completeExceptionally(future.cause());
                }
            });
            return written;
        }

        @Override
        public void close()
        {
            Channel ch = channel;
            if (ch != null) {
                ch.close();
            }
        }

        @Override
        public boolean isOpen()
        {
            Channel ch = channel;
            return ch != null && ch.isActive();
        }

        @Override
        public String remoteDescription()
        {
            return remote.getHostString() + ":" + remote.getPort();
        }

        private void notifyClosed()
        {
            if (closeNotified.compareAndSet(false, true)) {
                listener.onClosed(failure);
            }
        }

        /**
         * InboundHandler
         * ---------------------------------------------------------------------
         * Receives framed lines and forwards copies to the listener.
         */
        private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
        {
            @Override
            protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
            {
                // Copy out of the pooled buffer (Netty containment rule).
                byte[] bytes = new byte[frame.readableBytes()];
                frame.getBytes(frame.readerIndex(), bytes);
                listener.onMessage(bytes);
            }

            @Override
            public void channelInactive(ChannelHandlerContext ctx)
            {
                notifyClosed();
            }

            @Override
            public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
            {
                if (cause instanceof TooLongFrameException) {
                    listener.onFramingError(cause.getMessage());
                    return;
                }
                log.debug("Closing connection to {} after error", remoteDescription(), cause);
                failure = cause;
                ctx.close();
            }
        }
    }
}
