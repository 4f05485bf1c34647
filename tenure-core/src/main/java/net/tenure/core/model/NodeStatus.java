package net.tenure.core.model;

import java.util.Locale;

public enum NodeStatus {
    IDLE, COMPETING, LEADER, FOLLOWER, CRASHED;

    /** lower-case name used on the event wire */
    public String code() { return name().toLowerCase(Locale.ROOT); }
}
