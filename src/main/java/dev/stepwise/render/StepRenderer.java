package dev.stepwise.render;

import dev.stepwise.model.StepResult;
import dev.stepwise.model.Verbosity;

/**
 * Turns a finished run into text for some output format.
 */
public interface StepRenderer {

    /** Format name as used on the command line, e.g. {@code text}. */
    String format();

    /**
     * Render a result whose graph has been sealed.
     */
    String render(StepResult result, Verbosity verbosity);

    /**
     * Look up a bundled renderer by format name.
     *
     * @throws IllegalArgumentException for unknown formats
     */
    static StepRenderer forFormat(String format) {
        return switch (format) {
            case TextStepRenderer.FORMAT -> new TextStepRenderer();
            case JsonStepRenderer.FORMAT -> new JsonStepRenderer();
            default -> throw new IllegalArgumentException(
                "Unknown format '%s'. Valid formats: text, json".formatted(format));
        };
    }
}
