package com.techStack.geoVault.models.wfh;

public enum WfhStatus {
    PENDING,
    APPROVED,
    REJECTED
}
