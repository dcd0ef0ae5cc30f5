package com.pulse.template;

/**
 * Values for one render of an analytics-dialect (HogQL) template.
 *
 * Every field is optional. Clause fields ({@code dateFilter},
 * {@code userTypeFilter}, {@code sameTimeOfDayFilter}, {@code pathname}) are
 * removed from the query together with their leading {@code AND} when null or
 * empty; plain value fields are left untouched when null.
 */
public class HogqlTemplateContext {

    private Boolean filterInternal;
    private Boolean filterFree;
    private Integer limit;
    private Integer days;
    private String dateFunction;
    private String dateFilter;
    private String orderDirection;
    private String email;
    private String eventName;
    private String domain;
    private String userTypeFilter;
    private String periodSelect;
    private String sameTimeOfDayFilter;
    private String pathname;

    public static HogqlTemplateContext create() {
        return new HogqlTemplateContext();
    }

    public HogqlTemplateContext filterInternal(Boolean filterInternal) {
        this.filterInternal = filterInternal;
        return this;
    }

    public HogqlTemplateContext filterFree(Boolean filterFree) {
        this.filterFree = filterFree;
        return this;
    }

    public HogqlTemplateContext limit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public HogqlTemplateContext days(Integer days) {
        this.days = days;
        return this;
    }

    /**
     * @param dateFunction bucketing expression, e.g. {@code toStartOfWeek(timestamp)}
     */
    public HogqlTemplateContext dateFunction(String dateFunction) {
        this.dateFunction = dateFunction;
        return this;
    }

    /**
     * @param dateFilter bare boolean expression; the template supplies the {@code AND}
     */
    public HogqlTemplateContext dateFilter(String dateFilter) {
        this.dateFilter = dateFilter;
        return this;
    }

    /**
     * @param orderDirection {@code ASC} or {@code DESC}
     */
    public HogqlTemplateContext orderDirection(String orderDirection) {
        this.orderDirection = orderDirection;
        return this;
    }

    public HogqlTemplateContext email(String email) {
        this.email = email;
        return this;
    }

    public HogqlTemplateContext eventName(String eventName) {
        this.eventName = eventName;
        return this;
    }

    /**
     * @param domain email domain such as {@code acme.com}; fills {@code {{DOMAIN_LIKE}}} with {@code %@acme.com}
     */
    public HogqlTemplateContext domain(String domain) {
        this.domain = domain;
        return this;
    }

    /**
     * @param userTypeFilter clause selecting logged-in or anonymous users, or null for everyone
     */
    public HogqlTemplateContext userTypeFilter(String userTypeFilter) {
        this.userTypeFilter = userTypeFilter;
        return this;
    }

    public HogqlTemplateContext periodSelect(String periodSelect) {
        this.periodSelect = periodSelect;
        return this;
    }

    public HogqlTemplateContext sameTimeOfDayFilter(String sameTimeOfDayFilter) {
        this.sameTimeOfDayFilter = sameTimeOfDayFilter;
        return this;
    }

    public HogqlTemplateContext pathname(String pathname) {
        this.pathname = pathname;
        return this;
    }

    public Boolean getFilterInternal() {
        return filterInternal;
    }

    public Boolean getFilterFree() {
        return filterFree;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getDays() {
        return days;
    }

    public String getDateFunction() {
        return dateFunction;
    }

    public String getDateFilter() {
        return dateFilter;
    }

    public String getOrderDirection() {
        return orderDirection;
    }

    public String getEmail() {
        return email;
    }

    public String getEventName() {
        return eventName;
    }

    public String getDomain() {
        return domain;
    }

    public String getUserTypeFilter() {
        return userTypeFilter;
    }

    public String getPeriodSelect() {
        return periodSelect;
    }

    public String getSameTimeOfDayFilter() {
        return sameTimeOfDayFilter;
    }

    public String getPathname() {
        return pathname;
    }
}
