package lab.guardian.orchestration;

import lab.guardian.domain.approval.ApprovalRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/approvals")
@Slf4j
public class ApprovalController {

    private final TwoFactorApprovalService twoFactorApprovalService;

    @PostMapping
    public ResponseEntity<ApprovalRequest> create(@RequestBody CreateApprovalRequest req) {
        log.info("event=approval.create.request wallet={} action={} token={}", req.walletAddress(), req.action(), req.token());
        ApprovalRequest created = twoFactorApprovalService.create(req);
        log.info("event=approval.create.response approvalId={} status={}", created.getId(), created.getStatus().wireName());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<ApprovalRequest>> list(
            @RequestParam(required = false) String wallet,
            @RequestParam(required = false) String status
    ) {
        List<ApprovalRequest> rows = twoFactorApprovalService.list(wallet, status);
        log.info("event=approval.list.response wallet={} status={} count={}", wallet, status, rows.size());
        return ResponseEntity.ok(rows);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApprovalRequest> get(@PathVariable UUID id) {
        return ResponseEntity.ok(twoFactorApprovalService.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApprovalRequest> update(@PathVariable UUID id, @RequestBody UpdateApprovalRequest req) {
        log.info("event=approval.update.request approvalId={} status={}", id, req.status());
        ApprovalRequest row = twoFactorApprovalService.update(id, req);
        log.info("event=approval.update.response approvalId={} status={}", id, row.getStatus().wireName());
        return ResponseEntity.ok(row);
    }
}
