package io.clubone.outreach.outreach.schedule;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.OutreachScheduler;
import io.clubone.outreach.outreach.RunMode;
import io.clubone.outreach.outreach.model.OutreachRunSummary;
import io.clubone.outreach.outreach.ratelimit.OutreachRateLimiter;
import org.quartz.CronScheduleBuilder;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.quartz.QuartzJobBean;

/**
 * Quartz trigger for periodic LIVE outreach runs.
 * Configure via: clubone.outreach.scheduling.cron
 */
@Configuration
@ConditionalOnProperty(name = "clubone.outreach.scheduling.enabled", havingValue = "true", matchIfMissing = false)
public class OutreachJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(OutreachJobScheduler.class);

    @Bean
    public JobDetail outreachJobDetail() {
        return JobBuilder.newJob(OutreachQuartzJob.class)
            .withIdentity("outreachJob", "outreachGroup")
            .storeDurably()
            .build();
    }

    @Bean
    public Trigger outreachJobTrigger(OutreachProperties props) {
        String cronExpression = props.getScheduling().getCron();
        log.info("Outreach schedule registered: cron={}", cronExpression);
        return TriggerBuilder.newTrigger()
            .forJob(outreachJobDetail())
            .withIdentity("outreachTrigger", "outreachGroup")
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .build();
    }

    /**
     * Quartz job that runs the outreach scheduler in LIVE mode.
     */
    @DisallowConcurrentExecution
    public static class OutreachQuartzJob extends QuartzJobBean {

        private OutreachScheduler outreachScheduler;
        private OutreachRateLimiter rateLimiter;

        @Override
        protected void executeInternal(JobExecutionContext context) throws JobExecutionException {
            String scheduleId = context.getTrigger().getKey().getName();
            if (!rateLimiter.tryConsumeRun()) {
                log.warn("Scheduled outreach run skipped, run rate limit exceeded: scheduleId={}", scheduleId);
                return;
            }
            try {
                log.info("Scheduled outreach run triggered: scheduleId={}", scheduleId);
                OutreachRunSummary summary = outreachScheduler.run(RunMode.LIVE, "scheduler");
                if (!summary.isOk()) {
                    log.warn("Scheduled outreach run did not complete: scheduleId={} reason={}", scheduleId, summary.getReason());
                }
            } catch (Exception e) {
                log.error("Failed to execute scheduled outreach run", e);
                throw new JobExecutionException("Failed to execute scheduled outreach run", e);
            }
        }

        @Autowired
        public void setOutreachScheduler(OutreachScheduler outreachScheduler) {
            this.outreachScheduler = outreachScheduler;
        }

        @Autowired
        public void setRateLimiter(OutreachRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
        }
    }
}
