package com.docaudit.cli;

import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.config.ConfigLoader;
import com.docaudit.core.source.SourceScope;
import com.docaudit.core.util.FileUtils;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options selecting the base directory, configuration and audit scope. Mixed into commands.
 */
public class ScopeOptions {

    @Parameters(
        index = "0",
        description = "Base directory containing the corpus (default: current directory)",
        defaultValue = "."
    )
    private Path baseDirectory;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docaudit.yaml in the base directory)"
    )
    private Path configPath = Paths.get(AuditConfig.DEFAULT_FILE_NAME);

    @ArgGroup(exclusive = true)
    private Target target;

    @Option(
        names = {"--no-recursive"},
        description = "Only scan the top level of the directory"
    )
    private boolean noRecursive;

    static class Target {
        @Option(names = {"--file"}, description = "Audit a single Markdown file")
        String file;

        @Option(names = {"--dir"}, description = "Audit a directory instead of the configured corpus root")
        String directory;
    }

    public Path getBaseDirectory() {
        return baseDirectory.toAbsolutePath().normalize();
    }

    public AuditConfig loadConfig() {
        Path path = configPath.isAbsolute() ? configPath : getBaseDirectory().resolve(configPath);
        return ConfigLoader.load(path);
    }

    /**
     * Scope from the flags, falling back to the configured corpus root.
     *
     * @param config loaded configuration
     * @return audit scope
     */
    public SourceScope toScope(AuditConfig config) {
        boolean recursive = !noRecursive && config.corpus().recursive();
        if (target != null && target.file != null) {
            return SourceScope.singleFile(relativize(target.file));
        }
        if (target != null && target.directory != null) {
            return SourceScope.directory(relativize(target.directory), recursive);
        }
        return SourceScope.corpus(config.corpus().root(), recursive);
    }

    private String relativize(String value) {
        Path path = Paths.get(value);
        if (path.isAbsolute()) {
            path = getBaseDirectory().relativize(path.normalize());
        }
        String relative = FileUtils.toSlashPath(path.normalize());
        return relative.isEmpty() ? "." : relative;
    }
}
