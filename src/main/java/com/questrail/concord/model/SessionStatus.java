package com.questrail.concord.model;

public enum SessionStatus
{
    ACTIVE,
    ENDED
}
