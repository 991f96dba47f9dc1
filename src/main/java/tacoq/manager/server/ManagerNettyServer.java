package tacoq.manager.server;

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
import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server hosting the manager.
 * Owns the dependency container for the lifetime of the server.
 */
public final class ManagerNettyServer {

    private static final Logger log = LoggerFactory.getLogger(ManagerNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private ManagerNettyServer() {
    }

    /** HTTP pipeline for the REST API */
    static ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    /**
     * Create the dependencies, start the background loops and bind the HTTP port.
     *
     * @return true if the server is running afterwards
     */
    public static synchronized boolean start(int port, ManagerConfig config) {
        if (running) {
            return true;
        }
        try {
            dependencies = Dependencies.create(config);

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler()));

            serverChannel = b.bind(config.serverHost(), port).syncUninterruptibly().channel();
            dependencies.startScheduler();
            running = true;
            log.info("Manager started on port {}", port);
            return true;
        } catch (Exception e) {
            log.error("Manager failed to start on port {}", port, e);
            running = true; // let stop() release whatever was created
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
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
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
            log.info("Manager stopped");
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /**
     * Dependencies of the running server, null when stopped.
     */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
