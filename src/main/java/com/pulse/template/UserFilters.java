package com.pulse.template;

import com.pulse.context.AmbientRequestContext;
import com.pulse.context.RequestContext;

import java.util.List;

/**
 * Shared pieces of the user exclusion filter that both query dialects render
 * into their {@code {{USER_FILTER}}} placeholder.
 */
public final class UserFilters {

    /**
     * Email domain of the operator's own staff.
     */
    public static final String INTERNAL_DOMAIN = "gridstatus.io";

    /**
     * Bootstrap/test account excluded together with internal users.
     */
    public static final String BOOTSTRAP_ACCOUNT = "kmax12+dev@gmail.com";

    /**
     * Consumer email providers excluded when {@code filterFree} is on.
     */
    public static final List<String> FREE_EMAIL_DOMAINS = List.of(
        "gmail.com", "googlemail.com", "yahoo.com", "yahoo.co.uk", "outlook.com",
        "hotmail.com", "hotmail.co.uk", "live.com", "icloud.com", "mac.com", "me.com", "aol.com",
        "mail.com", "protonmail.com", "proton.me", "zoho.com", "yandex.com",
        "gmx.com", "gmx.net", "mail.ru", "qq.com", "163.com", "126.com",
        "comcast.net", "att.net", "verizon.net", "earthlink.net");

    private UserFilters() {
        throw new UnsupportedOperationException("UserFilters is a utility class and cannot be instantiated");
    }

    /**
     * Explicit value first, then the ambient request context, then true.
     */
    public static boolean resolveFilterInternal(Boolean explicit) {
        if (explicit != null) {
            return explicit;
        }
        RequestContext ambient = AmbientRequestContext.current();
        return ambient == null || ambient.filterInternal() == null || ambient.filterInternal();
    }

    public static boolean resolveFilterFree(Boolean explicit) {
        if (explicit != null) {
            return explicit;
        }
        RequestContext ambient = AmbientRequestContext.current();
        return ambient == null || ambient.filterFree() == null || ambient.filterFree();
    }

    /**
     * Doubles single quotes so the value cannot break out of a string literal.
     */
    public static String escapeQuotes(String value) {
        return value.replace("'", "''");
    }
}
