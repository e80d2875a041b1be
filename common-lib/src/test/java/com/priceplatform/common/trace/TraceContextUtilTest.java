package com.priceplatform.common.trace;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    private static Mono<String> readRequestId() {
        return Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getRequestId(ctx)));
    }

    @Test
    void requestIdTravelsThroughContext() {
        String seen = TraceContextUtil.withRequestId(readRequestId().map(String::toUpperCase), "refresh_1_abc")
            .block();
        assertEquals("REFRESH_1_ABC", seen);
    }

    @Test
    void missingRequestIdReadsAsNone() {
        assertEquals("none", readRequestId().block());
    }

    @Test
    void mdcIsSetOnlyDuringTheLogAction() {
        String[] during = new String[1];
        TraceContextUtil.withMdc("refresh_1_abc", () -> during[0] = MDC.get(TraceContextUtil.REQUEST_ID_KEY));

        assertEquals("refresh_1_abc", during[0]);
        assertNull(MDC.get(TraceContextUtil.REQUEST_ID_KEY));
    }
}
