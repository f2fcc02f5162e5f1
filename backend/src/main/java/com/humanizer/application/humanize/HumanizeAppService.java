package com.humanizer.application.humanize;

import com.humanizer.application.humanize.exception.TextTooLongException;
import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.domain.rewrite.model.RewriteOverrides;
import com.humanizer.domain.rewrite.model.StyleProfile;
import com.humanizer.domain.rewrite.service.HumanizerService;
import com.humanizer.infrastructure.rewrite.style.StyleProfileRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class HumanizeAppService {

    private final HumanizerService humanizerService;
    private final StyleProfileRegistry styleProfileRegistry;

    @Value("${humanizer.max-text-length:10000}")
    private int maxTextLength;

    public HumanizeResult humanize(String text, String style, RewriteOverrides overrides) {
        if (text.length() > maxTextLength) {
            throw new TextTooLongException(
                    String.format("Text must not exceed %d characters (got %d).", maxTextLength, text.length()));
        }

        long start = System.currentTimeMillis();
        HumanizeResult result = humanizerService.humanize(text, style, overrides);
        log.info("[Humanize] style={}, words {}->{}, sentences {}->{}, {}ms",
                result.styleUsed(),
                result.originalWordCount(), result.humanizedWordCount(),
                result.originalSentenceCount(), result.humanizedSentenceCount(),
                System.currentTimeMillis() - start);
        return result;
    }

    public Map<String, StyleProfile> styles() {
        return styleProfileRegistry.all();
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }
}
