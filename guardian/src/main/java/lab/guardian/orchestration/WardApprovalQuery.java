package lab.guardian.orchestration;

import java.util.List;

/**
 * Raw query parameters of {@code GET /ward-approvals}; parsing and defaults live in the service.
 */
public record WardApprovalQuery(
        String ward,
        String guardian,
        List<String> status,
        String includeAll,
        String updatedAfter,
        String limit,
        String offset
) {}
