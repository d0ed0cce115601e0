package com.docaudit.core.renderer;

/**
 * Report sink. Implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface OutputRenderer {

    /**
     * @return renderer identifier, e.g. {@code filesystem}
     */
    String getId();

    /**
     * Renders the output.
     *
     * @param output generated reports
     * @param context destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
