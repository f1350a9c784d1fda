package org.neuralchilli.sentinel.config;

/**
 * Which queues contribute to the pending job total.
 */
public enum JobsScope {
    /**
     * Sum every queue the backend reported on, whether or not it belongs to the job
     */
    ALL_REPORTED,

    /**
     * Sum only the job's own queues
     */
    RELEVANT
}
