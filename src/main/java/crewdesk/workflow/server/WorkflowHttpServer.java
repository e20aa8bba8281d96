package crewdesk.workflow.server;

import crewdesk.workflow.config.WorkflowConfig;
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
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the router.
 * Port 0 binds an ephemeral port; {@link #port()} reports the bound one.
 * The router runs on its own executor group so controllers may block on JDBC
 * and on the poll's call gaps without stalling the I/O threads.
 */
public final class WorkflowHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowHttpServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int HANDLER_THREADS = 16;

    private final WorkflowConfig config;
    private final RouterHandler router;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public WorkflowHttpServer(WorkflowConfig config, RouterHandler router) {
        this.config = config;
        this.router = router;
    }

    public synchronized void start() {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(HANDLER_THREADS);

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
                            p.addLast(handlerGroup, router);
                        }
                    });

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            log.info("HTTP server listening on {}:{}", config.serverHost(), port());
        } catch (RuntimeException e) {
            shutdownGroups();
            throw new RuntimeException("Failed to start HTTP server on port " + config.serverPort(), e);
        }
    }

    /**
     * The bound port, or -1 when not started.
     */
    public synchronized int port() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        try {
            serverChannel.close().syncUninterruptibly();
        } finally {
            serverChannel = null;
            shutdownGroups();
            log.info("HTTP server stopped");
        }
    }

    private void shutdownGroups() {
        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully();
            handlerGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    @Override
    public void close() {
        stop();
    }
}
