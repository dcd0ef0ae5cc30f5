package com.pulse.context;

/**
 * Per-request settings that renderers read without having them passed in.
 *
 * Created once per inbound request and never mutated. The filter flags are
 * nullable: {@code null} means the request did not say, and renderers fall
 * back to their own default.
 *
 * @param timezone       whitelisted timezone name, see {@link Timezones}
 * @param filterInternal whether operator-internal accounts are excluded, or null
 * @param filterFree     whether free-email-provider accounts are excluded, or null
 */
public record RequestContext(String timezone, Boolean filterInternal, Boolean filterFree) {

    public RequestContext {
        timezone = Timezones.sanitize(timezone);
    }
}
