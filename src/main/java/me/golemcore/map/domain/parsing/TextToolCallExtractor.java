package me.golemcore.map.domain.parsing;

import me.golemcore.map.domain.model.Message;

import java.util.Optional;

/**
 * Recovers a single tool call from free-form assistant text.
 *
 * <p>
 * Implementations are pure and gated on explicit vocabulary so that incidental
 * numbers or place names in prose do not trigger map actions.
 */
public interface TextToolCallExtractor {

    /**
     * @return the extracted call with origin {@code TEXT_EXTRACTED} and no id,
     *         or empty when the text does not express a request this extractor
     *         understands
     */
    Optional<Message.ToolCall> extract(String text);
}
