package harvester.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the {@link RouterHandler}.
 */
public final class CoordinatorServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorServer.class);

    /** Largest accepted request body; job submissions carry their targets inline. */
    private static final int MAX_CONTENT_LENGTH = 64 * 1024 * 1024;

    private final String host;
    private final int port;
    private final RouterHandler router;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public CoordinatorServer(String host, int port, RouterHandler router) {
        this.host = host;
        this.port = port;
        this.router = router;
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).sync().channel();
            log.info("HTTP server listening on {}:{}", host, boundPort());
        } catch (InterruptedException | RuntimeException e) {
            stop();
            throw e;
        }
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public synchronized int boundPort() {
        if (serverChannel == null) {
            return port;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
                log.info("HTTP server stopped");
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
        }
    }

    /**
     * Block until the server channel closes.
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
