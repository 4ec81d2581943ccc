package harvester.coordinator.server;

import harvester.coordinator.api.Controller;
import harvester.coordinator.api.Controller.ControllerResponse;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches API requests to the first registered controller that matches.
 * Errors are returned as {@code {"success":false,"error":...}}: unmatched
 * routes get 404, IllegalArgumentException (including ValidationException)
 * 400, anything else 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();
        boolean keepAlive = HttpUtil.isKeepAlive(req);
        long started = System.nanoTime();

        HttpResponseStatus status;
        try {
            Controller controller = find(method, path);
            if (controller == null) {
                status = NOT_FOUND;
                write(ctx, keepAlive, status, "application/json", errorBody("no route for " + method + " " + path));
            } else {
                ControllerResponse response = controller.handle(ctx, req, path);
                status = response.status();
                write(ctx, keepAlive, status, response.contentType(), response.body());
            }
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            status = BAD_REQUEST;
            write(ctx, keepAlive, status, "application/json", errorBody(e.getMessage()));
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            status = INTERNAL_SERVER_ERROR;
            write(ctx, keepAlive, status, "application/json", errorBody("internal error"));
        }

        log.debug("{} {} -> {} in {}ms", method, path, status.code(), (System.nanoTime() - started) / 1_000_000);
    }

    private Controller find(HttpMethod method, String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller;
            }
        }
        return null;
    }

    /**
     * Write a response, closing the channel if the client did not ask for
     * keep-alive or if writing fails.
     */
    private void write(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status,
            String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            HttpUtil.setKeepAlive(response, keepAlive);

            ChannelFuture future = ctx.writeAndFlush(response);
            if (!keepAlive) {
                future.addListener(ChannelFutureListener.CLOSE);
            }
        } catch (Exception e) {
            log.error("Failed to write {} response", status.code(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static String errorBody(String message) {
        return "{\"success\":false,\"error\":\"" + escapeJson(message) + "\"}";
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }
}
