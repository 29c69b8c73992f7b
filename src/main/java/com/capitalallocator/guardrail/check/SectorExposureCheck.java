package com.capitalallocator.guardrail.check;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.Position;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.guardrail.GuardrailCheck;
import com.capitalallocator.guardrail.GuardrailConfig;
import com.capitalallocator.guardrail.GuardrailContext;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Sector notional after this trade may not exceed the mandate's max sector exposure as a percent
 * of total capital.
 *
 * <p>Exposure counts open positions and pending reservations in the same sector, so cash already
 * promised to unfilled proposals is not double-counted as headroom.
 */
@Component
public class SectorExposureCheck implements GuardrailCheck {

    public static final String SECTOR_EXPOSURE_EXCEEDED = "SECTOR_EXPOSURE_EXCEEDED";
    public static final String SECTOR_UNKNOWN = "SECTOR_UNKNOWN";

    private final GuardrailConfig guardrailConfig;

    public SectorExposureCheck(GuardrailConfig guardrailConfig) {
        this.guardrailConfig = guardrailConfig;
    }

    @Override
    public GuardrailCheckType getType() {
        return GuardrailCheckType.SECTOR_EXPOSURE;
    }

    @Override
    public CheckResult evaluate(GuardrailContext context) {
        String sector = context.getSignal().getSector();
        if (sector == null || sector.isBlank() || "UNKNOWN".equalsIgnoreCase(sector)) {
            return CheckResult.passWithInfo(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.INFO,
                            SECTOR_UNKNOWN,
                            "Sector unknown for " + context.getSignal().getSymbol() + ", exposure not checked"));
        }

        BigDecimal existing = BigDecimal.ZERO;
        for (Position position : context.getOpenPositions()) {
            if (position.isOpen() && sector.equalsIgnoreCase(position.getSector())) {
                existing = existing.add(position.getNotional());
            }
        }
        BigDecimal pending = BigDecimal.ZERO;
        for (Reservation reservation : context.getPendingReservations()) {
            if (reservation.isPending() && sector.equalsIgnoreCase(reservation.getSector())) {
                pending = pending.add(reservation.getAmount());
            }
        }

        BigDecimal limitPercent = context.getMandate().getMaxSectorExposurePercent() != null
                ? context.getMandate().getMaxSectorExposurePercent()
                : guardrailConfig.getDefaultSectorExposurePercent();
        BigDecimal limit = Money.percentOf(limitPercent, context.getAccount().getTotalCapital());
        BigDecimal after = Money.of(existing.add(pending).add(context.getNotional()));

        if (after.compareTo(limit) > 0) {
            return CheckResult.critical(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.CRITICAL,
                            SECTOR_EXPOSURE_EXCEEDED,
                            "Sector " + sector + " exposure would be " + after + ", limit " + limit,
                            Map.of(
                                    "sector", sector,
                                    "openNotional", Money.of(existing),
                                    "pendingReserved", Money.of(pending),
                                    "exposureAfter", after,
                                    "limit", limit,
                                    "limitPercent", limitPercent)));
        }
        return CheckResult.pass(getType());
    }
}
