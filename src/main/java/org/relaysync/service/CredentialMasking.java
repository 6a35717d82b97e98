package org.relaysync.service;

import org.relaysync.model.AdminAuth;
import org.relaysync.model.Job;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Hides secrets on the way out and restores them on the way back in.
 * <p>
 * Outgoing jobs carry {@link #PLACEHOLDER} instead of the password, DNS token and notifier token.
 * An incoming value that is null or equal to the placeholder keeps the stored secret; anything
 * else, the empty string included, replaces it.
 */
public final class CredentialMasking {

    public static final String PLACEHOLDER = "********";

    private CredentialMasking() {}

    public static Job mask(Job job) {
        Job masked = job.copy();
        masked.setPassword(maskValue(job.getPassword()));
        masked.setDnsToken(maskValue(job.getDnsToken()));
        masked.setNotifierToken(maskValue(job.getNotifierToken()));
        return masked;
    }

    public static AdminAuth mask(AdminAuth auth) {
        return new AdminAuth(auth.username(), maskValue(auth.password()));
    }

    /**
     * Builds the job to store from an administrative write. Definition fields come from
     * {@code incoming}, secrets per the placeholder rule, and result fields plus rule domains
     * always from {@code previous}.
     *
     * @param previous the stored job, or null when the job is new
     */
    public static Job merge(Job incoming, Job previous) {
        Job merged = incoming.copy();
        Job base = previous != null ? previous : new Job();

        keep(merged, base, Job::getPassword, Job::setPassword);
        keep(merged, base, Job::getDnsToken, Job::setDnsToken);
        keep(merged, base, Job::getNotifierToken, Job::setNotifierToken);

        merged.copyResultsFrom(base);
        merged.setRuleDomains(base.copy().getRuleDomains());
        return merged;
    }

    public static AdminAuth merge(AdminAuth incoming, AdminAuth previous) {
        if (incoming == null) {
            return previous;
        }
        String username = incoming.username() != null ? incoming.username() : previous.username();
        String password = isMasked(incoming.password()) ? previous.password() : incoming.password();
        return new AdminAuth(username, password);
    }

    public static boolean isMasked(String value) {
        return value == null || PLACEHOLDER.equals(value);
    }

    private static void keep(Job merged, Job previous, Function<Job, String> getter, BiConsumer<Job, String> setter) {
        if (isMasked(getter.apply(merged))) {
            setter.accept(merged, getter.apply(previous));
        }
    }

    private static String maskValue(String secret) {
        return secret == null || secret.isEmpty() ? secret : PLACEHOLDER;
    }
}
