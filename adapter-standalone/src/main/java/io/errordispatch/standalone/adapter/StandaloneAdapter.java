package io.errordispatch.standalone.adapter;

import io.errordispatch.core.model.HttpHeaders;
import io.errordispatch.core.model.MediaType;
import io.errordispatch.core.model.MessageBody;
import io.errordispatch.core.model.Request;
import io.errordispatch.core.model.Response;
import io.errordispatch.core.spi.GatewayAdapter;
import io.javalin.http.Context;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway adapter for Javalin's {@link Context}.
 *
 * <p>{@link #wrapRequest(Context)} copies the request data, so handlers never see the live
 * servlet request. Header names are normalized to lowercase.
 *
 * <p>This class is thread-safe: all state is local to each method invocation.
 */
public final class StandaloneAdapter implements GatewayAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneAdapter.class);

    @Override
    public Request wrapRequest(Context ctx) {
        HttpHeaders headers = buildHeaders(ctx);
        byte[] bytes = ctx.bodyAsBytes();
        MessageBody body = bytes == null || bytes.length == 0
                ? MessageBody.empty()
                : MessageBody.of(bytes, MediaType.fromContentType(ctx.contentType()));

        String method = ctx.method().name();
        String path = ctx.path();

        LOG.debug("wrapRequest: {} {} (body={} bytes, headers={})", method, path, body.size(),
                headers.toSingleValueMap().size());

        return new Request(method, path, ctx.queryString(), headers, body);
    }

    @Override
    public void applyResponse(Response response, Context ctx) {
        ctx.status(response.status());
        response.headers().toMultiValueMap().forEach((name, values) -> {
            if ("content-type".equals(name)) {
                return;
            }
            for (String value : values) {
                ctx.res().addHeader(name, value);
            }
        });
        if (response.contentType() != null) {
            ctx.contentType(response.contentType());
        }
        ctx.result(response.body().content());

        LOG.debug(
                "applyResponse: status={}, headers={}, body={} bytes",
                response.status(),
                response.headers().toSingleValueMap().size(),
                response.body().size());
    }

    /** Copies all request header values, keyed by lowercase name. */
    private static HttpHeaders buildHeaders(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        var headerNames = ctx.req().getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                var values = ctx.req().getHeaders(name);
                List<String> valueList = new ArrayList<>();
                if (values != null) {
                    while (values.hasMoreElements()) {
                        valueList.add(values.nextElement());
                    }
                }
                headersAll.put(name.toLowerCase(), Collections.unmodifiableList(valueList));
            }
        }
        return HttpHeaders.ofMulti(headersAll);
    }
}
