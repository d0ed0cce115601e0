package com.docaudit.core.renderer.impl;

import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.renderer.GeneratedOutput;
import com.docaudit.core.renderer.OutputRenderer;
import com.docaudit.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated reports to the console with optional ANSI colors.
 *
 * <p><b>Settings:</b></p>
 * <ul>
 *   <li>{@code console.colors} - enable ANSI colors ("true"/"false", default "true")</li>
 *   <li>{@code console.showHeaders} - print a header per report (default "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String ID = "console";

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        log.debug("Rendering {} reports to console (colors: {})", output.reports().size(), useColors);

        for (int i = 0; i < output.reports().size(); i++) {
            GeneratedReport report = output.reports().get(i);
            if (showHeaders) {
                out.println(color(useColors, ANSI_BOLD + ANSI_CYAN, report.fileName()));
                out.println(color(useColors, ANSI_YELLOW, SEPARATOR));
            }
            out.println(report.content());
            if (i < output.reports().size() - 1) {
                out.println(color(useColors, ANSI_YELLOW, SEPARATOR));
            }
        }
        out.flush();
    }

    private static String color(boolean useColors, String code, String text) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
