package com.approvalgate.infrastructure.security;

/**
 * Role names issued by the identity provider.
 */
public final class Roles {

    public static final String FINANCE_READ = "finance-read";
    public static final String FINANCE_WRITE = "finance-write";
    public static final String HR_READ = "hr-read";
    public static final String HR_WRITE = "hr-write";

    /** Holds every domain write permission. */
    public static final String EXECUTIVE = "executive";

    private Roles() {}
}
