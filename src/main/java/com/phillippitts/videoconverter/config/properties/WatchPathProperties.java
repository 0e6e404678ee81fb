package com.phillippitts.videoconverter.config.properties;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * One {@code converter.directories.watch-paths} entry.
 *
 * <p>{@code recursive}, {@code file-patterns} and {@code output-dir} are optional; when
 * absent the directory-level defaults apply.
 */
public class WatchPathProperties {

    @NotBlank(message = "watch path must not be blank")
    private String path;

    private boolean enabled = true;

    private Boolean recursive;

    private List<String> filePatterns;

    private String outputDir;

    public WatchPathProperties() {
    }

    public WatchPathProperties(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Boolean getRecursive() {
        return recursive;
    }

    public void setRecursive(Boolean recursive) {
        this.recursive = recursive;
    }

    public List<String> getFilePatterns() {
        return filePatterns;
    }

    public void setFilePatterns(List<String> filePatterns) {
        this.filePatterns = filePatterns;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }
}
