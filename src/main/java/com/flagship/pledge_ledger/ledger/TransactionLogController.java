package com.flagship.pledge_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the audit trail, newest first.
 */
@RestController
@RequiredArgsConstructor
public class TransactionLogController {

    private final TransactionLogService transactionLogService;

    @GetMapping("/api/transaction-logs")
    public List<TransactionLog> allLogs() {
        return transactionLogService.findAll();
    }

    @GetMapping("/api/entries/{id}/transaction-logs")
    public List<TransactionLog> logsForEntry(@PathVariable("id") long id) {
        return transactionLogService.findForRecord(RecordKind.PLEDGE, id);
    }

    @GetMapping("/api/outstanding/{id}/transaction-logs")
    public List<TransactionLog> logsForOutstanding(@PathVariable("id") long id) {
        return transactionLogService.findForRecord(RecordKind.OUTSTANDING, id);
    }
}
