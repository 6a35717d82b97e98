package org.relaysync.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One configured job: a panel account bound to one DNS record and one notification target.
 * <p>
 * Definition fields are written by administrative calls. The result fields
 * ({@code user_info}, {@code forward_rules}, {@code device_groups}, {@code last_log},
 * {@code last_run}) are written only by the job executor. Instances are mutable; the store
 * hands out copies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {

    public static final int DEFAULT_INTERVAL_MINUTES = 15;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("interval_minutes")
    private int intervalMinutes = DEFAULT_INTERVAL_MINUTES;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    @JsonProperty("provider_host")
    @JsonAlias("nya_host")
    private String providerHost;

    @JsonProperty("dns_token")
    @JsonAlias("cf_token")
    private String dnsToken;

    @JsonProperty("domain")
    private String domain;

    @JsonProperty("notifier_token")
    @JsonAlias("telegram_bot_token")
    private String notifierToken;

    @JsonProperty("notifier_target")
    @JsonAlias("telegram_chat_id")
    private String notifierTarget;

    @JsonProperty("rule_domains")
    private Map<String, List<String>> ruleDomains = new LinkedHashMap<>();

    // results

    @JsonProperty("user_info")
    private String userInfo;

    @JsonProperty("forward_rules")
    private List<ForwardRule> forwardRules;

    @JsonProperty("device_groups")
    private List<DeviceGroup> deviceGroups;

    @JsonProperty("last_log")
    @JsonDeserialize(using = LogLinesDeserializer.class)
    private List<String> lastLog;

    @JsonProperty("last_run")
    private OffsetDateTime lastRun;

    public Job() {}

    public Job copy() {
        Job c = new Job();
        c.enabled = enabled;
        c.intervalMinutes = intervalMinutes;
        c.username = username;
        c.password = password;
        c.providerHost = providerHost;
        c.dnsToken = dnsToken;
        c.domain = domain;
        c.notifierToken = notifierToken;
        c.notifierTarget = notifierTarget;
        c.ruleDomains = copyRuleDomains(ruleDomains);
        c.copyResultsFrom(this);
        return c;
    }

    /**
     * Overwrites this job's result fields with those of {@code other}.
     */
    public void copyResultsFrom(Job other) {
        userInfo = other.userInfo;
        forwardRules = other.forwardRules == null ? null : new ArrayList<>(other.forwardRules);
        deviceGroups = other.deviceGroups == null ? null : new ArrayList<>(other.deviceGroups);
        lastLog = other.lastLog == null ? null : new ArrayList<>(other.lastLog);
        lastRun = other.lastRun;
    }

    /**
     * Only these two fields drive scheduling.
     */
    @JsonIgnore
    public boolean isSchedulable() {
        return enabled && intervalMinutes > 0;
    }

    public boolean hasDnsConfig() {
        return dnsToken != null && !dnsToken.isBlank() && domain != null && !domain.isBlank();
    }

    public boolean hasNotifierConfig() {
        return notifierToken != null && !notifierToken.isBlank()
                && notifierTarget != null && !notifierTarget.isBlank();
    }

    private static Map<String, List<String>> copyRuleDomains(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((rule, domains) -> copy.put(rule, domains == null ? new ArrayList<>() : new ArrayList<>(domains)));
        }
        return copy;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getIntervalMinutes() { return intervalMinutes; }
    public void setIntervalMinutes(int intervalMinutes) { this.intervalMinutes = intervalMinutes; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getProviderHost() { return providerHost; }
    public void setProviderHost(String providerHost) { this.providerHost = providerHost; }

    public String getDnsToken() { return dnsToken; }
    public void setDnsToken(String dnsToken) { this.dnsToken = dnsToken; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public String getNotifierToken() { return notifierToken; }
    public void setNotifierToken(String notifierToken) { this.notifierToken = notifierToken; }

    public String getNotifierTarget() { return notifierTarget; }
    public void setNotifierTarget(String notifierTarget) { this.notifierTarget = notifierTarget; }

    public Map<String, List<String>> getRuleDomains() { return ruleDomains; }
    public void setRuleDomains(Map<String, List<String>> ruleDomains) {
        this.ruleDomains = ruleDomains == null ? new LinkedHashMap<>() : ruleDomains;
    }

    public String getUserInfo() { return userInfo; }
    public void setUserInfo(String userInfo) { this.userInfo = userInfo; }

    public List<ForwardRule> getForwardRules() { return forwardRules; }
    public void setForwardRules(List<ForwardRule> forwardRules) { this.forwardRules = forwardRules; }

    public List<DeviceGroup> getDeviceGroups() { return deviceGroups; }
    public void setDeviceGroups(List<DeviceGroup> deviceGroups) { this.deviceGroups = deviceGroups; }

    public List<String> getLastLog() { return lastLog; }
    public void setLastLog(List<String> lastLog) { this.lastLog = lastLog; }

    public OffsetDateTime getLastRun() { return lastRun; }
    public void setLastRun(OffsetDateTime lastRun) { this.lastRun = lastRun; }
}
