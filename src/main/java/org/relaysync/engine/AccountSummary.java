package org.relaysync.engine;

import org.relaysync.client.account.TrafficStatistic;
import org.relaysync.client.account.UserInfo;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human-readable rendering of panel account data, stored as a job's {@code user_info}.
 */
public final class AccountSummary {

    private static final double KIB = 1024d;
    private static final double MIB = KIB * 1024d;
    private static final double GIB = MIB * 1024d;
    private static final DateTimeFormatter EXPIRY = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private AccountSummary() {}

    public static String userInfo(UserInfo info) {
        String expiry = info.expire() > 0 ? EXPIRY.format(Instant.ofEpochMilli(info.expire())) : "never";
        long speedMbps = Math.round(info.speedLimit() / 1_000_000d * 8);
        return "Username: " + orUnknown(info.username()) + "\n"
                + "Group: " + orUnknown(info.groupName()) + "\n"
                + "Plan: " + orUnknown(info.planName()) + "\n"
                + "Expires: " + expiry + "\n"
                + "Renewal price: " + orZero(info.renewPrice()) + "\n"
                + "Traffic: " + fixed(info.trafficUsed() / GIB) + " GiB / " + fixed(info.trafficEnable() / GIB) + " GiB\n"
                + "Max rules: " + info.maxRules() + "\n"
                + "Speed limit: " + speedMbps + " Mbps\n"
                + "Balance: " + orZero(info.balance());
    }

    public static String traffic(TrafficStatistic stat) {
        return "Traffic today: " + bytes(stat.trafficToday()) + "\n"
                + "Traffic yesterday: " + bytes(stat.trafficYesterday());
    }

    static String bytes(long value) {
        if (value < MIB) return fixed(value / KIB) + " KiB";
        if (value < GIB) return fixed(value / MIB) + " MiB";
        return fixed(value / GIB) + " GiB";
    }

    private static String fixed(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    private static String orZero(String value) {
        return value == null || value.isBlank() ? "0" : value;
    }
}
