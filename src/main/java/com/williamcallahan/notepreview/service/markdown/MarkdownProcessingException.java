package com.williamcallahan.notepreview.service.markdown;

/**
 * Signals a failure inside one stage of the preview pipeline.
 *
 * <p>Stages catch it at their boundary and degrade, so it never reaches the view.</p>
 */
public class MarkdownProcessingException extends IllegalStateException {

    /**
     * Creates a markdown processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkdownProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
