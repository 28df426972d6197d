package com.purchasingpower.autoreview.model.review;

public enum ReviewVerdict {
    APPROVE,
    COMMENT,
    REQUEST_CHANGES
}
