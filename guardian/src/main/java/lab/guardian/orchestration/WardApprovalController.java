package lab.guardian.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import lab.guardian.domain.wardapproval.WardApprovalRequest;
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
@RequestMapping("/ward-approvals")
@Slf4j
public class WardApprovalController {

    private final WardApprovalService wardApprovalService;

    @PostMapping
    public ResponseEntity<WardApprovalRequest> create(@RequestBody CreateWardApprovalRequest req) {
        log.info(
                "event=ward_approval.create.request ward={} guardian={} action={} token={} initialStatus={}",
                req.wardAddress(),
                req.guardianAddress(),
                req.action(),
                req.token(),
                req.initialStatus()
        );
        WardApprovalRequest created = wardApprovalService.create(req);
        log.info(
                "event=ward_approval.create.response approvalId={} status={}",
                created.getId(),
                created.getStatus().wireName()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // Pending requests for a ward or guardian inbox; see WardApprovalService#list for the defaults.
    @GetMapping
    public ResponseEntity<List<WardApprovalRequest>> list(
            @RequestParam(required = false) String ward,
            @RequestParam(required = false) String guardian,
            @RequestParam(required = false) List<String> status,
            @RequestParam(name = "include_all", required = false) String includeAll,
            @RequestParam(name = "updated_after", required = false) String updatedAfter,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String offset
    ) {
        log.info(
                "event=ward_approval.list.request ward={} guardian={} status={} includeAll={} updatedAfter={}",
                ward,
                guardian,
                status,
                includeAll,
                updatedAfter
        );
        List<WardApprovalRequest> rows = wardApprovalService.list(
                new WardApprovalQuery(ward, guardian, status, includeAll, updatedAfter, limit, offset)
        );
        log.info("event=ward_approval.list.response count={}", rows.size());
        return ResponseEntity.ok(rows);
    }

    @GetMapping("/history")
    public ResponseEntity<List<WardApprovalRequest>> history(
            @RequestParam(required = false) String ward,
            @RequestParam(required = false) String guardian,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String offset
    ) {
        List<WardApprovalRequest> rows = wardApprovalService.history(ward, guardian, limit, offset);
        log.info("event=ward_approval.history.response ward={} guardian={} count={}", ward, guardian, rows.size());
        return ResponseEntity.ok(rows);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WardApprovalRequest> get(@PathVariable UUID id) {
        log.info("event=ward_approval.get.request approvalId={}", id);
        WardApprovalRequest row = wardApprovalService.get(id);
        log.info("event=ward_approval.get.response approvalId={} status={}", id, row.getStatus().wireName());
        return ResponseEntity.ok(row);
    }

    // A lost compare-and-swap still answers 200 with the row that won; callers compare status and event_version.
    @PatchMapping("/{id}")
    public ResponseEntity<WardApprovalRequest> update(@PathVariable UUID id, @RequestBody JsonNode body) {
        WardApprovalPatch patch = WardApprovalPatch.from(body);
        log.info(
                "event=ward_approval.update.request approvalId={} status={} fields={}",
                id,
                patch.status() == null ? null : patch.status().wireName(),
                patch.columns().keySet()
        );
        WardApprovalRequest row = wardApprovalService.update(id, patch);
        log.info(
                "event=ward_approval.update.response approvalId={} status={} eventVersion={}",
                id,
                row.getStatus().wireName(),
                row.getEventVersion()
        );
        return ResponseEntity.ok(row);
    }
}
