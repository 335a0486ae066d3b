package com.umitunal.qcron.executor;

import java.util.Collections;
import java.util.Map;

/**
 * Code run for one job type. Supplied by the embedding application and registered
 * under its type tag in a {@link JobHandlerRegistry}.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run one occurrence.
     *
     * @param params the job's stored parameters, unmodified
     * @return the outcome; throwing is recorded as a failure
     * @throws Exception if the run fails
     */
    Result handle(Map<String, Object> params) throws Exception;

    /**
     * Result of a handler run.
     */
    class Result {
        private final boolean success;
        private final String message;
        private final Map<String, Object> payload;

        private Result(boolean success, String message, Map<String, Object> payload) {
            this.success = success;
            this.message = message;
            this.payload = payload;
        }

        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }
        public Map<String, Object> getPayload() { return payload; }

        public static Result success() {
            return new Result(true, null, null);
        }

        public static Result success(Map<String, Object> payload) {
            return new Result(true, null, payload != null ? Collections.unmodifiableMap(payload) : null);
        }

        public static Result failure(String message) {
            return new Result(false, message, null);
        }
    }
}
