package io.b2mash.timeledger.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the time ledger.
 *
 * @param displayZone user-facing timezone; month buckets and log detail strings are computed in it
 * @param logLimit upper bound on the number of log entries returned by one query
 * @param allowedUsers display names accepted at login; empty means any name
 * @param totalsCacheTtl maximum lifetime of a cached month-totals result
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
    @DefaultValue("Europe/Zurich") ZoneId displayZone,
    @DefaultValue("500") int logLimit,
    @DefaultValue List<String> allowedUsers,
    @DefaultValue("30s") Duration totalsCacheTtl) {

  public boolean isAllowed(String name) {
    return allowedUsers.isEmpty() || allowedUsers.stream().map(String::trim).anyMatch(name::equals);
  }
}
