package com.investorchat.orchestrator.logger;

import com.investorchat.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage a chat request passes through. Pure side-effects; no pipeline logic.
 *
 * <p>Stages (in order): {@link #PLANNING} → {@link #ROUTING} → {@link #GATHERING}
 * (data-backed intents only) → {@link #SYNTHESIZING} → {@link #DONE}.
 *
 * <pre>
 *     .doOnEach(chatFlowLogger.stage(ChatFlowLogger.PLANNING))
 * </pre>
 */
@Component
public class ChatFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ChatFlowLogger.class);

    public static final String PLANNING     = "PLANNING";
    public static final String ROUTING      = "ROUTING";
    public static final String GATHERING    = "GATHERING";
    public static final String SYNTHESIZING = "SYNTHESIZING";
    public static final String DONE         = "DONE";

    /**
     * Returns a {@code doOnEach} consumer that logs completion of {@code stageName}.
     * Reads the requestId from the Reactor Context; fires on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String requestId = TraceContextUtil.getRequestId(signal.getContextView());
            TraceContextUtil.withMdc(requestId, () ->
                log.info("[ChatFlow] stage={} requestId={}", stageName, requestId)
            );
        };
    }

    /** Logs a stage with a free-form detail when the requestId is already at hand. */
    public void logWithRequestId(String stageName, String requestId, String detail) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[ChatFlow] stage={} {} requestId={}", stageName, detail, requestId)
        );
    }
}
