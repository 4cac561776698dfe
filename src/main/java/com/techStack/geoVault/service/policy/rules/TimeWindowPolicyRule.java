package com.techStack.geoVault.service.policy.rules;

import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * {@code now} must fall in {@code [start, end)}. A window whose start is after its end wraps midnight,
 * so 22:00-06:00 admits 23:30 and 05:59 but not 06:00.
 */
@Slf4j
@Component
@Order(30)
public class TimeWindowPolicyRule implements PolicyRule {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public String name() {
        return "time";
    }

    @Override
    public RuleOutcome evaluate(AccessRequest request, AccessPolicy policy, LocalTime now) {
        LocalTime start;
        LocalTime end;
        try {
            start = LocalTime.parse(policy.getStartTime(), HH_MM);
            end = LocalTime.parse(policy.getEndTime(), HH_MM);
        } catch (DateTimeParseException | NullPointerException e) {
            log.error("Invalid time window in access policy: {}-{}", policy.getStartTime(), policy.getEndTime());
            return RuleOutcome.fail("Invalid time format in config: "
                    + policy.getStartTime() + "-" + policy.getEndTime());
        }

        String current = now.format(HH_MM);
        if (isWithin(now, start, end)) {
            return RuleOutcome.pass("Time validated (" + current + ")");
        }
        return RuleOutcome.fail("Outside allowed hours (current: " + current + ", allowed: "
                + policy.getStartTime() + "-" + policy.getEndTime() + ")");
    }

    static boolean isWithin(LocalTime now, LocalTime start, LocalTime end) {
        if (start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !now.isBefore(start) && now.isBefore(end);
        }
        return !now.isBefore(start) || now.isBefore(end);
    }
}
