package com.foreman.core.scheduler;

import com.foreman.core.model.Feature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes which pending features may run next, based on dependency satisfaction,
 * running state and priority.
 */
public class FeatureSelector {

    private static final Logger log = LoggerFactory.getLogger(FeatureSelector.class);

    /**
     * Filter and order pending features for dispatch.
     *
     * @param pending     pending features in loader order
     * @param allFeatures every feature of the project, or null to skip dependency checks
     * @param finished    whether a feature is already done
     * @param running     whether a feature id is already running
     * @return eligible features, most urgent first; ties keep loader order
     */
    public List<Feature> selectEligible(List<Feature> pending, List<Feature> allFeatures,
                                        AutoLoopCallbacks.FeatureFinishedPredicate finished,
                                        AutoLoopCallbacks.FeatureRunningPredicate running) {
        Map<String, Feature> byId = null;
        if (allFeatures != null) {
            byId = new HashMap<>();
            for (Feature f : allFeatures) {
                byId.put(f.id(), f);
            }
        }

        var eligible = new ArrayList<Feature>();
        for (Feature feature : pending) {
            if (finished.isFinished(feature)) {
                log.debug("  {} - already finished", feature.id());
                continue;
            }
            if (running.isRunning(feature.id())) {
                log.debug("  {} - already running", feature.id());
                continue;
            }
            if (byId != null && !dependenciesSatisfied(feature, byId)) {
                log.debug("  {} - deps unsatisfied: {}", feature.id(), feature.dependencies());
                continue;
            }
            log.debug("  {} - eligible (priority {})", feature.id(), feature.effectivePriority());
            eligible.add(feature);
        }
        // List.sort is stable, so equal priorities keep loader order
        eligible.sort(Comparator.comparingInt(Feature::effectivePriority));
        return eligible;
    }

    /**
     * A dependency is satisfied when it is unknown to the project or has reached
     * completed or verified.
     */
    public static boolean dependenciesSatisfied(Feature feature, Map<String, Feature> allById) {
        for (String depId : feature.dependencies()) {
            Feature dep = allById.get(depId);
            if (dep != null && !dep.status().isTerminalSuccess()) {
                return false;
            }
        }
        return true;
    }
}
