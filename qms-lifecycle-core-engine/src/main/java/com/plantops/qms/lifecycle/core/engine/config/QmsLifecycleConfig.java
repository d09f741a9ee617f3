package com.plantops.qms.lifecycle.core.engine.config;

import com.plantops.qms.lifecycle.core.exception.QmsLifecycleConfigurationException;
import com.plantops.qms.lifecycle.core.exception.codes.QmsLifecycleErrorCodes;
import com.plantops.qms.lifecycle.core.util.QmsBeanValidation;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tunable parameters of the lifecycle engine.
 *
 * Timeline dates are rendered in {@link #getTimelineZone()}; approval-gated
 * transitions are open to actors holding one of the roles configured for the
 * record kind.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class QmsLifecycleConfig {

    public static final String ROLE_QUALITY_MANAGER = "quality_manager";
    public static final String ROLE_SUPPLIER_QUALITY_ENGINEER = "supplier_quality_engineer";
    public static final String ROLE_MRB_MEMBER = "mrb_member";

    // Timeline rendering
    @NotNull
    @Builder.Default
    private final ZoneId timelineZone = ZoneOffset.UTC;

    @NotBlank
    @Builder.Default
    private final String tooltipDatePattern = "MMM d, yyyy";

    @NotNull
    @Builder.Default
    private final Locale tooltipLocale = Locale.US;

    // Approval
    @NotNull
    @Builder.Default
    private final Map<QmsRecordKind, Set<String>> approverRoles = Map.of(
            QmsRecordKind.NCR, Set.of(ROLE_QUALITY_MANAGER),
            QmsRecordKind.CAPA, Set.of(ROLE_QUALITY_MANAGER),
            QmsRecordKind.SCAR, Set.of(ROLE_QUALITY_MANAGER, ROLE_SUPPLIER_QUALITY_ENGINEER),
            QmsRecordKind.MRB, Set.of(ROLE_QUALITY_MANAGER, ROLE_MRB_MEMBER)
    );

    // Collaborators
    @NotNull
    @Builder.Default
    private final Duration publishTimeout = Duration.ofSeconds(10);

    @NotNull
    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    /**
     * Creates the default configuration: UTC timeline, US date format, standard approver roles.
     */
    public static QmsLifecycleConfig defaultConfig() {
        return QmsLifecycleConfig.builder().build();
    }

    /**
     * Creates a configuration with a fixed clock, for reproducible timestamps.
     */
    public static QmsLifecycleConfig withClock(Clock clock) {
        return QmsLifecycleConfig.builder().clock(clock).build();
    }

    public Set<String> getApproverRoles(QmsRecordKind kind) {
        return approverRoles.getOrDefault(kind, Set.of());
    }

    public DateTimeFormatter tooltipDateFormatter() {
        return DateTimeFormatter.ofPattern(tooltipDatePattern, tooltipLocale).withZone(timelineZone);
    }

    /**
     * Validates the configuration.
     *
     * @throws QmsLifecycleConfigurationException if configuration is invalid
     */
    public void validate() {
        List<String> violations = new ArrayList<>(QmsBeanValidation.violationsOf(this));
        if (publishTimeout != null && (publishTimeout.isNegative() || publishTimeout.isZero())) {
            violations.add("publishTimeout: must be positive");
        }
        if (tooltipDatePattern != null && !tooltipDatePattern.isBlank()) {
            try {
                DateTimeFormatter.ofPattern(tooltipDatePattern);
            } catch (IllegalArgumentException e) {
                violations.add("tooltipDatePattern: " + e.getMessage());
            }
        }
        if (!violations.isEmpty()) {
            throw new QmsLifecycleConfigurationException(QmsLifecycleErrorCodes.CONFIGURATION_INVALID, violations);
        }
    }
}
