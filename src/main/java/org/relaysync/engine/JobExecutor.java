package org.relaysync.engine;

import org.relaysync.client.ClientException;
import org.relaysync.client.account.AccountClient;
import org.relaysync.client.account.AccountSession;
import org.relaysync.client.account.TrafficStatistic;
import org.relaysync.client.account.UserInfo;
import org.relaysync.client.dns.DnsClient;
import org.relaysync.client.dns.DnsRecord;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.DeviceGroup;
import org.relaysync.model.ForwardRule;
import org.relaysync.model.Job;
import org.relaysync.notifications.MessageTemplates;
import org.relaysync.notifications.NotificationSender;
import org.relaysync.store.ConfigStore;
import org.relaysync.utils.ZoneUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JobExecutor: one complete run of one job.
 * <p>
 * Steps, in order: read the job fresh from the store, fetch the panel account, pick the target
 * address from the primary inbound device group, bring the DNS record in line with it, and notify
 * when the record changed. Remote failures end the run early and are recorded in the run log;
 * they never escape. The outcome is written back with one keyed update of the job.
 */
public class JobExecutor implements JobRunner {
    private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);

    public static final long PRIMARY_INBOUND_GROUP_ID = 1;
    public static final int DNS_TTL_SECONDS = 120;
    public static final int LOG_CAP = 200;

    private static final DateTimeFormatter NOTIFY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ConfigStore store;
    private final AccountClient accounts;
    private final DnsClient dns;
    private final NotificationSender notifier;
    private final MessageTemplates templates;
    private final Clock clock;
    private final ZoneId defaultZone;

    public JobExecutor(ConfigStore store, AccountClient accounts, DnsClient dns, NotificationSender notifier,
                       MessageTemplates templates, Clock clock, ZoneId defaultZone) {
        this.store = store;
        this.accounts = accounts;
        this.dns = dns;
        this.notifier = notifier;
        this.templates = templates;
        this.clock = clock;
        this.defaultZone = defaultZone;
    }

    @Override
    public RunResult run(String jobId) {
        ConfigSnapshot snapshot = store.getSnapshot();
        ZoneId zone = ZoneUtil.resolve(snapshot.timezone(), defaultZone);
        Job job = snapshot.jobs().get(jobId);
        if (job == null) {
            logger.warn("Job {} no longer exists, skipping run", jobId);
            return RunResult.skipped(jobId, now(zone));
        }

        JobRun run = new JobRun(jobId, job, zone, new RunLog(zone, clock, LOG_CAP, logger));
        try {
            execute(run);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in run of job {}", jobId, e);
            run.fail(RunError.INTERNAL, "Error: unexpected failure: " + e);
        }
        return persist(run);
    }

    private void execute(JobRun run) {
        Job job = run.job();

        try {
            fetchAccount(run);
        } catch (ClientException e) {
            run.fail(RunError.of(e), "Error: account fetch failed [" + e.getKind() + "]: " + e.getMessage());
            return;
        }

        Optional<String> target = targetAddress(run);
        if (target.isEmpty()) {
            return;
        }
        String ip = target.get();

        if (!job.hasDnsConfig()) {
            run.dns(DnsOutcome.NOT_CONFIGURED);
            run.log("DNS sync not configured (token or domain missing), skipping DNS update");
            return;
        }

        String domain = job.getDomain().trim();
        Optional<String> oldIp = syncDns(run, domain, ip);
        oldIp.ifPresent(previous -> notifyChange(run, domain, previous, ip));
    }

    /**
     * Login, device groups, user info, traffic statistic, forward rules, logout. The statistic and
     * the logout are best effort; any other failure aborts the fetch.
     */
    private void fetchAccount(JobRun run) throws ClientException {
        Job job = run.job();
        AccountSession session = accounts.login(job.getProviderHost(), job.getUsername(), job.getPassword());
        run.log("Logged in to " + session.host().replaceFirst("^https?://", ""));
        try {
            List<DeviceGroup> groups = accounts.deviceGroups(session);
            Map<Long, DeviceGroup> groupsById = new LinkedHashMap<>();
            groups.forEach(g -> groupsById.put(g.id(), g));
            run.log("Fetched " + groups.size() + " device groups");

            UserInfo info = accounts.userInfo(session);
            String summary = AccountSummary.userInfo(info);
            run.log("User info:");
            for (String line : summary.split("\n")) {
                run.log("  " + line);
            }

            String traffic;
            try {
                traffic = AccountSummary.traffic(accounts.trafficStatistic(session));
            } catch (ClientException e) {
                run.log("Traffic statistic unavailable [" + e.getKind() + "]: " + e.getMessage());
                traffic = AccountSummary.traffic(TrafficStatistic.empty());
            }
            run.log("Traffic statistic: " + traffic.replace("\n", " | "));

            List<ForwardRule> rules = accounts.forwardRules(session, groupsById);
            run.log("Fetched " + rules.size() + " forward rules");

            run.recordAccount(summary + "\n" + traffic, rules, groups);
        } finally {
            logout(run, session);
        }
    }

    private void logout(JobRun run, AccountSession session) {
        try {
            accounts.logout(session);
            run.log("Logged out");
        } catch (ClientException e) {
            run.log("Logout failed [" + e.getKind() + "]: " + e.getMessage());
        }
    }

    private Optional<String> targetAddress(JobRun run) {
        Optional<DeviceGroup> primary = TargetAddress.findGroup(run.deviceGroups(), PRIMARY_INBOUND_GROUP_ID);
        if (primary.isEmpty()) {
            run.fail(RunError.NO_TARGET_ADDRESS,
                    "Error: no device group with id " + PRIMARY_INBOUND_GROUP_ID + ", cannot determine target IP");
            return Optional.empty();
        }
        Optional<String> ip = TargetAddress.firstIpv4(primary.get().connectHost());
        if (ip.isEmpty()) {
            run.fail(RunError.NO_TARGET_ADDRESS, "Error: device group " + PRIMARY_INBOUND_GROUP_ID
                    + " connect host '" + primary.get().connectHost() + "' holds no IPv4 address");
            return Optional.empty();
        }
        run.log("Target IP from device group " + primary.get().name() + ": " + ip.get());
        return ip;
    }

    /**
     * @return the previous record value when the record was changed, empty otherwise
     */
    private Optional<String> syncDns(JobRun run, String domain, String ip) {
        String token = run.job().getDnsToken().trim();
        try {
            Optional<String> zoneId = Optional.empty();
            for (String candidate : zoneCandidates(domain)) {
                zoneId = dns.findZoneId(token, candidate);
                if (zoneId.isPresent()) {
                    run.log("Zone: " + candidate + ", ID: " + zoneId.get());
                    break;
                }
            }
            if (zoneId.isEmpty()) {
                run.dns(DnsOutcome.RECORD_NOT_FOUND);
                run.fail(RunError.RECORD_NOT_FOUND, "Error: no DNS zone found for " + domain + ", skipping DNS update");
                return Optional.empty();
            }

            Optional<DnsRecord> record = dns.findRecord(token, zoneId.get(), domain);
            if (record.isEmpty()) {
                run.dns(DnsOutcome.RECORD_NOT_FOUND);
                run.fail(RunError.RECORD_NOT_FOUND, "Error: no A record for " + domain + ", skipping DNS update");
                return Optional.empty();
            }

            String current = record.get().content();
            if (ip.equals(current)) {
                run.dns(DnsOutcome.UNCHANGED);
                run.log(domain + " is up to date: " + ip);
                return Optional.empty();
            }

            dns.updateRecord(token, zoneId.get(), record.get(), ip, DNS_TTL_SECONDS);
            run.dns(DnsOutcome.UPDATED);
            run.log("Updated " + domain + ": " + current + " -> " + ip);
            return Optional.of(current == null ? "" : current);
        } catch (ClientException e) {
            run.dns(DnsOutcome.FAILED);
            run.fail(RunError.of(e), "Error: DNS sync failed [" + e.getKind() + "]: " + e.getMessage());
            return Optional.empty();
        }
    }

    private void notifyChange(JobRun run, String domain, String oldIp, String newIp) {
        Job job = run.job();
        if (!job.hasNotifierConfig()) {
            run.notification(NotifyOutcome.NOT_CONFIGURED);
            run.log("Notifier not configured, skipping notification");
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("time", NOTIFY_TIME.format(now(run.zone())));
        data.put("domain", domain);
        data.put("oldIp", oldIp);
        data.put("newIp", newIp);
        String message = templates.render(MessageTemplates.DNS_UPDATED, data);

        try {
            notifier.send(job.getNotifierToken(), job.getNotifierTarget(), message);
            run.notification(NotifyOutcome.SENT);
            run.log("Notification sent");
        } catch (ClientException e) {
            run.notification(NotifyOutcome.FAILED);
            run.log("Notification failed [" + e.getKind() + "]: " + e.getMessage());
        }
    }

    private RunResult persist(JobRun run) {
        OffsetDateTime finishedAt = now(run.zone());
        List<String> lines = run.runLog().lines();

        boolean found = store.updateJob(run.jobId(), current -> {
            current.setLastLog(new ArrayList<>(lines));
            current.setLastRun(finishedAt);
            if (run.accountFetched()) {
                current.setUserInfo(run.userInfo());
                current.setForwardRules(new ArrayList<>(run.forwardRules()));
                current.setDeviceGroups(new ArrayList<>(run.deviceGroups()));
            }
            return current;
        });
        if (!found) {
            logger.warn("Job {} was deleted during its run, results discarded", run.jobId());
        }
        return run.finish(finishedAt);
    }

    /**
     * Parent suffixes of {@code domain}, longest first, down to the two-label registrable name.
     * A two-label domain is its own zone apex.
     */
    static List<String> zoneCandidates(String domain) {
        String name = domain.endsWith(".") ? domain.substring(0, domain.length() - 1) : domain;
        String[] labels = name.split("\\.");
        List<String> candidates = new ArrayList<>();
        if (labels.length <= 2) {
            candidates.add(name);
            return candidates;
        }
        for (int i = 1; i <= labels.length - 2; i++) {
            candidates.add(String.join(".", Arrays.copyOfRange(labels, i, labels.length)));
        }
        return candidates;
    }

    private OffsetDateTime now(ZoneId zone) {
        return OffsetDateTime.ofInstant(clock.instant(), zone);
    }
}
