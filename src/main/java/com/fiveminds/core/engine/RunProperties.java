package com.fiveminds.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "fiveminds.run")
public class RunProperties {

    private double approvalThreshold = 0.7;
    private int maxFollowUpDepth = 1;
    /** Repository the run scans, copies into sandboxes and integrates into. Blank means none. */
    private String repositoryPath = "";

    public double getApprovalThreshold() { return approvalThreshold; }
    public void setApprovalThreshold(double approvalThreshold) { this.approvalThreshold = approvalThreshold; }
    public int getMaxFollowUpDepth() { return maxFollowUpDepth; }
    public void setMaxFollowUpDepth(int maxFollowUpDepth) { this.maxFollowUpDepth = maxFollowUpDepth; }
    public String getRepositoryPath() { return repositoryPath; }
    public void setRepositoryPath(String repositoryPath) { this.repositoryPath = repositoryPath; }
}
