package lab.guardian.orchestration.activity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/activity")
@Slf4j
public class ActivityController {

    private final ActivityService activityService;

    @GetMapping
    public ResponseEntity<ActivityPage> feed(
            @RequestParam(required = false) String wallet,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String offset
    ) {
        log.info("event=activity.feed.request wallet={} limit={} offset={}", wallet, limit, offset);
        ActivityPage page = activityService.feed(wallet, limit, offset);
        log.info("event=activity.feed.response wallet={} returned={} total={} hasMore={}", wallet, page.records().size(), page.total(), page.hasMore());
        return ResponseEntity.ok(page);
    }
}
