package com.fiveminds.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "fiveminds.sandbox")
public class SandboxProperties {

    /** Parent directory for sandbox workspaces. Blank means the system temp directory. */
    private String root = "";
    private int maxRunners = 4;
    private int timeoutSeconds = 300;
    /** Upper bound on simultaneously live sandboxes; 0 means unbounded. */
    private int maxActive = 0;
    private List<String> excludes = new ArrayList<>(List.of(
            ".git", "node_modules", "__pycache__", "venv", "env", ".venv",
            "target", "build", ".gradle", ".idea", ".vscode"
    ));

    public Path getRootPath() {
        return root == null || root.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"), "fiveminds-sandboxes")
                : Path.of(root);
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
    public int getMaxRunners() { return maxRunners; }
    public void setMaxRunners(int maxRunners) { this.maxRunners = maxRunners; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getMaxActive() { return maxActive; }
    public void setMaxActive(int maxActive) { this.maxActive = maxActive; }
    public List<String> getExcludes() { return excludes; }
    public void setExcludes(List<String> excludes) { this.excludes = excludes; }
}
