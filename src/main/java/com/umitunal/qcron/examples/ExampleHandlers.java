package com.umitunal.qcron.examples;

import com.umitunal.qcron.executor.JobHandler;
import com.umitunal.qcron.executor.JobHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Demo handlers: a fake e-mail sender and a number summer.
 */
public final class ExampleHandlers {
    private static final Logger logger = LoggerFactory.getLogger(ExampleHandlers.class);

    public static final String EMAIL_NOTIFICATION = "email_notification";
    public static final String NUMBER_CRUNCHING = "number_crunching";

    private ExampleHandlers() {
    }

    public static JobHandlerRegistry registry() {
        return new JobHandlerRegistry()
                .register(EMAIL_NOTIFICATION, ExampleHandlers::sendEmail)
                .register(NUMBER_CRUNCHING, ExampleHandlers::crunchNumbers);
    }

    static JobHandler.Result sendEmail(Map<String, Object> params) {
        Object to = params.get("to");
        if (to == null) {
            return JobHandler.Result.failure("missing 'to'");
        }
        logger.info("Sending email to {} subject='{}'", to, params.get("subject"));
        return JobHandler.Result.success();
    }

    static JobHandler.Result crunchNumbers(Map<String, Object> params) {
        Object numbers = params.get("numbers");
        if (!(numbers instanceof List)) {
            return JobHandler.Result.failure("'numbers' must be a list");
        }
        List<?> list = (List<?>) numbers;
        double sum = 0;
        for (Object n : list) {
            sum += ((Number) n).doubleValue();
        }
        logger.info("Crunched {} numbers, sum={}", list.size(), sum);
        return JobHandler.Result.success(Map.of("count", list.size(), "sum", sum));
    }
}
