package com.marketloop.api.controller;

import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.Reflection;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.domain.model.WeeklyReport;
import com.marketloop.exception.BusinessException;
import com.marketloop.exception.ErrorCode;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.reflection.ReflectionService;
import com.marketloop.reporting.WeeklyReportService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the ledger.
 * <ul>
 *   <li>GET /api/trades?status=open|closed|cancelled</li>
 *   <li>GET /api/positions</li>
 *   <li>GET /api/reflections</li>
 *   <li>GET /api/reports/weekly</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class RecordsController {

    private final TradeLedgerService tradeLedgerService;
    private final ReflectionService reflectionService;
    private final WeeklyReportService weeklyReportService;

    public RecordsController(
            TradeLedgerService tradeLedgerService,
            ReflectionService reflectionService,
            WeeklyReportService weeklyReportService) {
        this.tradeLedgerService = tradeLedgerService;
        this.reflectionService = reflectionService;
        this.weeklyReportService = weeklyReportService;
    }

    @GetMapping("/trades")
    public ResponseEntity<List<TradeRecord>> trades(@RequestParam(required = false) String status) {
        return ResponseEntity.ok(tradeLedgerService.getTrades(parseStatus(status)));
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> positions() {
        return ResponseEntity.ok(tradeLedgerService.getOpenPositions());
    }

    @GetMapping("/reflections")
    public ResponseEntity<List<Reflection>> reflections() {
        return ResponseEntity.ok(reflectionService.getAll());
    }

    @GetMapping("/reports/weekly")
    public ResponseEntity<List<WeeklyReport>> weeklyReports() {
        return ResponseEntity.ok(weeklyReportService.getAll());
    }

    private static TradeStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TradeStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Invalid trade status: " + status + " (expected open, closed or cancelled)");
        }
    }
}
