package lab.guardian.orchestration.activity;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ActivityConfig {

    public static final String FAN_OUT_EXECUTOR = "activityFanOutExecutor";

    // Fixed size; reads beyond it queue.
    @Bean(name = FAN_OUT_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService activityFanOutExecutor(@Value("${guardian.activity.fan-out-threads:8}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "activity-fan-out-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), threadFactory);
    }
}
