package com.workgraph.core.analytics;

import com.workgraph.core.model.Priority;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scoring constants and operation defaults for the analytics engine.
 * The defaults reproduce the documented formulas; deployments may tune them.
 */
@Component
@ConfigurationProperties(prefix = "workgraph.analytics")
public class AnalyticsProperties {

    private Weights weights = new Weights();
    private Scoring scoring = new Scoring();
    private Defaults defaults = new Defaults();

    public int weight(Priority priority) {
        return switch (priority) {
            case CRITICAL -> weights.critical;
            case HIGH -> weights.high;
            case MEDIUM -> weights.medium;
            case LOW -> weights.low;
        };
    }

    public Weights getWeights() { return weights; }
    public void setWeights(Weights weights) { this.weights = weights; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }

    public static class Weights {
        private int critical = Priority.CRITICAL.defaultWeight();
        private int high = Priority.HIGH.defaultWeight();
        private int medium = Priority.MEDIUM.defaultWeight();
        private int low = Priority.LOW.defaultWeight();

        public int getCritical() { return critical; }
        public void setCritical(int critical) { this.critical = critical; }
        public int getHigh() { return high; }
        public void setHigh(int high) { this.high = high; }
        public int getMedium() { return medium; }
        public void setMedium(int medium) { this.medium = medium; }
        public int getLow() { return low; }
        public void setLow(int low) { this.low = low; }
    }

    public static class Scoring {
        /** Weight of dependents reached only transitively, relative to direct ones. */
        private double transitiveFactor = 0.5;
        private double priorityCoefficient = 10;
        private double unlockCoefficient = 2;
        private double effortDivisor = 4;
        private double maxEffortPenalty = 5;
        private int unlocksReasonThreshold = 3;
        private double quickWinHours = 4;

        public double getTransitiveFactor() { return transitiveFactor; }
        public void setTransitiveFactor(double transitiveFactor) { this.transitiveFactor = transitiveFactor; }
        public double getPriorityCoefficient() { return priorityCoefficient; }
        public void setPriorityCoefficient(double priorityCoefficient) { this.priorityCoefficient = priorityCoefficient; }
        public double getUnlockCoefficient() { return unlockCoefficient; }
        public void setUnlockCoefficient(double unlockCoefficient) { this.unlockCoefficient = unlockCoefficient; }
        public double getEffortDivisor() { return effortDivisor; }
        public void setEffortDivisor(double effortDivisor) { this.effortDivisor = effortDivisor; }
        public double getMaxEffortPenalty() { return maxEffortPenalty; }
        public void setMaxEffortPenalty(double maxEffortPenalty) { this.maxEffortPenalty = maxEffortPenalty; }
        public int getUnlocksReasonThreshold() { return unlocksReasonThreshold; }
        public void setUnlocksReasonThreshold(int unlocksReasonThreshold) { this.unlocksReasonThreshold = unlocksReasonThreshold; }
        public double getQuickWinHours() { return quickWinHours; }
        public void setQuickWinHours(double quickWinHours) { this.quickWinHours = quickWinHours; }
    }

    public static class Defaults {
        private int topN = 5;
        private int minImpact = 1;
        private int maxAgents = 5;
        private int agentCount = 1;
        private int lookahead = 5;
        private int spofThreshold = 2;
        private int queueSize = 10;
        /** Deadline for one analytics call in milliseconds; zero or less means none. */
        private long timeoutMs = 0;

        public int getTopN() { return topN; }
        public void setTopN(int topN) { this.topN = topN; }
        public int getMinImpact() { return minImpact; }
        public void setMinImpact(int minImpact) { this.minImpact = minImpact; }
        public int getMaxAgents() { return maxAgents; }
        public void setMaxAgents(int maxAgents) { this.maxAgents = maxAgents; }
        public int getAgentCount() { return agentCount; }
        public void setAgentCount(int agentCount) { this.agentCount = agentCount; }
        public int getLookahead() { return lookahead; }
        public void setLookahead(int lookahead) { this.lookahead = lookahead; }
        public int getSpofThreshold() { return spofThreshold; }
        public void setSpofThreshold(int spofThreshold) { this.spofThreshold = spofThreshold; }
        public int getQueueSize() { return queueSize; }
        public void setQueueSize(int queueSize) { this.queueSize = queueSize; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }
}
