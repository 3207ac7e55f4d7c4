package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.model.AveragingMode;
import io.github.jakubt4.pmfusion.model.EnsembleOffset;
import io.github.jakubt4.pmfusion.model.FrameDescriptor;
import io.github.jakubt4.pmfusion.model.FrameMeasurement;
import io.github.jakubt4.pmfusion.model.IterationDiagnostics;
import io.github.jakubt4.pmfusion.model.IterationState;
import io.github.jakubt4.pmfusion.model.MeasurementKind;
import io.github.jakubt4.pmfusion.model.ProperMotion;
import io.github.jakubt4.pmfusion.model.RefinementResult;
import io.github.jakubt4.pmfusion.model.Star;
import io.github.jakubt4.pmfusion.model.TerminationReason;
import io.github.jakubt4.pmfusion.service.transform.AlignmentStar;
import io.github.jakubt4.pmfusion.service.transform.FitSelection;
import io.github.jakubt4.pmfusion.service.transform.FrameTransformer;
import io.github.jakubt4.pmfusion.service.transform.TransformRequest;
import io.github.jakubt4.pmfusion.service.transform.TransformResult;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.util.FastMath;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Iterative cross-epoch alignment engine.
 *
 * <p>Each iteration aligns every frame in parallel on the current star snapshot, then merges the
 * results sequentially: quality gate, per-star aggregation, absolute calibration, optional
 * membership update and the convergence check. {@link #step} is the transition between two
 * immutable {@link IterationState}s; the frame fan-out is the only concurrent part and is fully
 * joined before the step runs.
 *
 * <p>Frame and star failures only exclude the frame or star from the iteration. A first iteration
 * in which no frame passes the quality gate aborts the run with {@link AlignmentException}; a later
 * one ends it with the previous iteration's estimate. Reaching an iteration cap is reported as a
 * warning and still yields the latest estimate.
 */
@Slf4j
@Service
public class ConvergenceController {

    private static final double[] RELATIVE_ORIGIN = {0.0, 0.0};

    private final AlignmentProperties properties;
    private final FrameTransformer frameTransformer;
    private final QualityGate qualityGate;
    private final WeightedAggregator weightedAggregator;
    private final AbsoluteCalibrator absoluteCalibrator;
    private final MembershipClassifier membershipClassifier;
    private final DiagnosticsSink diagnosticsSink;
    private final EpochConverter epochConverter;
    private final ExecutorService frameWorkerPool;

    public ConvergenceController(final AlignmentProperties properties,
                                 final FrameTransformer frameTransformer,
                                 final QualityGate qualityGate,
                                 final WeightedAggregator weightedAggregator,
                                 final AbsoluteCalibrator absoluteCalibrator,
                                 final MembershipClassifier membershipClassifier,
                                 final DiagnosticsSink diagnosticsSink,
                                 final EpochConverter epochConverter,
                                 @Qualifier("frameWorkerPool") final ExecutorService frameWorkerPool) {
        this.properties = properties;
        this.frameTransformer = frameTransformer;
        this.qualityGate = qualityGate;
        this.weightedAggregator = weightedAggregator;
        this.absoluteCalibrator = absoluteCalibrator;
        this.membershipClassifier = membershipClassifier;
        this.diagnosticsSink = diagnosticsSink;
        this.epochConverter = epochConverter;
        this.frameWorkerPool = frameWorkerPool;
    }

    /**
     * Runs the refinement loop to termination.
     *
     * @param catalog reference catalog, candidate flags already seeded
     * @param frames  first-epoch frames
     * @return stars with an absolute proper motion, plus the convergence history
     * @throws IllegalArgumentException if the catalog or the frame list is empty
     * @throws AlignmentException       if the first iteration has no usable frame
     */
    public RefinementResult refine(final List<Star> catalog, final List<FrameDescriptor> frames) {
        if (catalog.isEmpty()) {
            throw new IllegalArgumentException("The reference catalog is empty");
        }
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("At least one frame is required");
        }
        final var referenceEpoch = epochConverter.toJulianYear(properties.getReferenceEpoch());

        var state = initialize(catalog);
        log.info("Refinement started: {} stars, {} frames, policy {}, reference epoch {}",
                catalog.size(), frames.size(), properties.getPolicy(), referenceEpoch);

        while (!state.isDone()) {
            final var outcomes = transformFrames(state, frames, referenceEpoch);
            state = step(state, outcomes);
        }

        final var absoluteKind = properties.getAveraging().absoluteKind();
        final var measured = state.stars().stream()
                .filter(star -> star.measurement(absoluteKind).map(ProperMotion::isFinite).orElse(false))
                .toList();
        final var alignmentMotion = alignmentMotion(measured);
        log.info("Refinement finished: {} after {} iterations, {} stars measured",
                state.termination(), state.history().size(), measured.size());
        if (alignmentMotion != null) {
            log.info("Average absolute PM of alignment stars: pmra = {} +- {}, pmdec = {} +- {} mas/yr",
                    String.format("%.4f", alignmentMotion.pmRa()), String.format("%.4f", alignmentMotion.pmRaError()),
                    String.format("%.4f", alignmentMotion.pmDec()), String.format("%.4f", alignmentMotion.pmDecError()));
        }
        return new RefinementResult(measured, state.history(), state.history().size(), state.termination(),
                alignmentMotion);
    }

    /**
     * Averages the absolute motions of the measured alignment stars with the configured statistic.
     *
     * @return {@code null} when no alignment star has an absolute motion
     */
    ProperMotion alignmentMotion(final List<Star> measured) {
        final var mode = properties.getAveraging();
        final var motions = measured.stream()
                .filter(Star::useForAlignment)
                .map(star -> star.measurement(mode.absoluteKind()))
                .flatMap(Optional::stream)
                .filter(ProperMotion::isFinite)
                .toList();
        if (motions.isEmpty()) {
            return null;
        }
        final var pmRa = weightedAggregator.aggregate(
                motions.stream().mapToDouble(ProperMotion::pmRa).toArray(),
                motions.stream().mapToDouble(ProperMotion::pmRaError).toArray());
        final var pmDec = weightedAggregator.aggregate(
                motions.stream().mapToDouble(ProperMotion::pmDec).toArray(),
                motions.stream().mapToDouble(ProperMotion::pmDecError).toArray());
        return new ProperMotion(pmRa.value(mode), pmRa.error(mode), pmDec.value(mode), pmDec.error(mode));
    }

    /**
     * Seeds the alignment flags from the candidate flags, or flags every star when the catalog
     * carries no candidate at all.
     */
    IterationState initialize(final List<Star> catalog) {
        log.debug("Phase {}", RefinementPhase.INIT);
        final var seeded = catalog.stream().anyMatch(Star::candidateMember);
        final var stars = catalog.stream()
                .map(star -> seeded
                        ? star.withUseForAlignment(star.candidateMember())
                        : star.withCandidateMember(true).withUseForAlignment(true))
                .toList();
        if (!seeded) {
            log.info("No membership seed supplied, aligning on all {} stars", stars.size());
        }
        return IterationState.initial(stars);
    }

    /**
     * Aligns every frame on an immutable snapshot of the current stars and waits for all of them.
     */
    List<TransformResult> transformFrames(final IterationState state,
                                          final List<FrameDescriptor> frames,
                                          final double referenceEpoch) {
        log.debug("Iteration {}: phase {}", state.iteration(), RefinementPhase.PER_FRAME_TRANSFORM);
        final var rewind = isRewound(state.iteration());
        final var snapshot = state.stars().stream()
                .map(star -> toAlignmentStar(star, rewind))
                .toList();

        final var tasks = new ArrayList<Callable<TransformResult>>(frames.size());
        for (final var frame : frames) {
            final var request = new TransformRequest(frame, snapshot,
                    state.excludedFromFit(frame.frameId()), referenceEpoch, rewind,
                    fitSelection(state, frame.frameId()));
            tasks.add(() -> runTransformer(request));
        }

        try {
            final var futures = frameWorkerPool.invokeAll(tasks);
            final var results = new ArrayList<TransformResult>(futures.size());
            for (var i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (final ExecutionException e) {
                    results.add(new TransformResult.Failed(frames.get(i).frameId(), String.valueOf(e.getCause())));
                }
            }
            return results;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlignmentException("Interrupted while aligning frames", e);
        }
    }

    /**
     * Merges one iteration's frame results into the next state. When a later iteration has no
     * usable frame, the previous state is returned terminated with
     * {@link TerminationReason#NO_USABLE_FRAMES}.
     *
     * @throws AlignmentException if no frame of the first iteration passes the quality gate
     */
    public IterationState step(final IterationState previous, final List<TransformResult> outcomes) {
        final var iteration = previous.iteration();

        final var excluded = new HashMap<>(previous.excludedFromFit());
        final var fieldAligned = new HashSet<>(previous.fieldAlignedFrames());
        final var measurements = new ArrayList<FrameMeasurement>();
        var framesUsed = 0;
        for (final var outcome : outcomes) {
            if (outcome instanceof TransformResult.Failed failed) {
                log.warn("[{}] no match in iteration {}: {}", failed.frameId(), iteration, failed.reason());
                continue;
            }
            final var matched = (TransformResult.Matched) outcome;
            if (matched.fieldAligned()) {
                fieldAligned.add(matched.frameId());
            }
            final var verdict = qualityGate.assess(matched.transformation());
            if (properties.isFixTransformations() && !verdict.rejected().isEmpty()) {
                excluded.merge(matched.frameId(), verdict.rejected(), ConvergenceController::union);
            }
            if (verdict.usable()) {
                framesUsed++;
                measurements.addAll(matched.measurements());
                log.info("[{}] matched {} stars", matched.frameId(), matched.measurements().size());
            } else {
                log.warn("[{}] bad quality match, skipped in iteration {}: {}",
                        matched.frameId(), iteration, String.join("; ", verdict.failures()));
            }
        }
        if (framesUsed == 0) {
            if (previous.history().isEmpty()) {
                throw new AlignmentException("No frame produced a valid alignment in iteration " + iteration
                        + ". Please try with other parameters.");
            }
            log.warn("No frame produced a valid alignment in iteration {}, keeping the results of iteration {}",
                    iteration, iteration - 1);
            return new IterationState(iteration - 1, previous.stars(), excluded, fieldAligned,
                    previous.history(), TerminationReason.NO_USABLE_FRAMES);
        }

        log.debug("Iteration {}: phase {}", iteration, RefinementPhase.AGGREGATE);
        final var aggregates = weightedAggregator.aggregateStars(measurements);

        log.debug("Iteration {}: phase {}", iteration, RefinementPhase.CALIBRATE);
        final var calibration = absoluteCalibrator.calibrate(previous.stars(), aggregates);
        var stars = previous.stars().stream()
                .map(star -> star.withMeasurements(
                        calibration.measurements().getOrDefault(star.sourceId(), Map.of())))
                .toList();

        if (properties.isMembershipRefinement()) {
            log.debug("Iteration {}: phase {}", iteration, RefinementPhase.MEMBERSHIP_UPDATE);
            stars = updateMembership(stars, iteration);
        }

        log.debug("Iteration {}: phase {}", iteration, RefinementPhase.CONVERGENCE_CHECK);
        final var diagnostics = diagnostics(iteration, framesUsed, previous, stars,
                calibration.offsets().get(properties.getAveraging()));
        diagnosticsSink.iterationCompleted(diagnostics);

        final var history = new ArrayList<>(previous.history());
        history.add(diagnostics);
        final var termination = checkConvergence(previous, stars, diagnostics);
        if (termination != null) {
            log.debug("Iteration {}: phase {} ({})", iteration, RefinementPhase.DONE, termination);
            return new IterationState(iteration, stars, excluded, fieldAligned, history, termination);
        }
        return new IterationState(iteration + 1, stars, excluded, fieldAligned, history, null);
    }

    private static FitSelection fitSelection(final IterationState state, final String frameId) {
        if (state.fieldAlignedFrames().contains(frameId)) {
            return FitSelection.ALL_STARS;
        }
        return state.iteration() == 0 ? FitSelection.FIELD_FALLBACK : FitSelection.ALIGNMENT_STARS;
    }

    private static Set<Long> union(final Set<Long> left, final Set<Long> right) {
        final var merged = new HashSet<>(left);
        merged.addAll(right);
        return merged;
    }

    private TransformResult runTransformer(final TransformRequest request) {
        try {
            return frameTransformer.transform(request);
        } catch (final RuntimeException e) {
            log.error("[{}] transformer failed: {}", request.frame().frameId(), e.getMessage());
            return new TransformResult.Failed(request.frame().frameId(), "transformer error: " + e.getMessage());
        }
    }

    private boolean isRewound(final int iteration) {
        return properties.isRewindStars() && iteration > 0;
    }

    private AlignmentStar toAlignmentStar(final Star star, final boolean rewind) {
        var motion = star.referenceMotion();
        if (rewind) {
            motion = star.measurement(properties.getAveraging().absoluteKind())
                    .filter(ProperMotion::isFinite)
                    .orElse(motion);
        }
        return new AlignmentStar(star.sourceId(), star.ra(), star.dec(), star.raError(), star.decError(),
                motion.pmRa(), motion.pmDec(), star.useForAlignment());
    }

    private List<Star> updateMembership(final List<Star> stars, final int iteration) {
        final var relativeKind = properties.getAveraging().relativeKind();
        final var points = new ArrayList<double[]>(stars.size());
        final var candidates = new ArrayList<Boolean>(stars.size());
        for (final var star : stars) {
            points.add(star.measurement(relativeKind)
                    .filter(ProperMotion::isFinite)
                    .map(pm -> new double[] {pm.pmRa(), pm.pmDec()})
                    .orElse(null));
            candidates.add(star.candidateMember());
        }

        // rewound frames are already anchored near the absolute frame, so only
        // unrewound relative motions are known to centre on the origin
        final var anchor = isRewound(iteration) ? null : RELATIVE_ORIGIN;
        final var outcome = membershipClassifier.classify(points, candidates, anchor);
        if (outcome instanceof MembershipOutcome.NoUpdate noUpdate) {
            log.warn("Membership unchanged in iteration {}: {}", iteration, noUpdate.reason());
            return stars;
        }

        final var updated = (MembershipOutcome.Updated) outcome;
        final var result = new ArrayList<Star>(stars.size());
        for (var i = 0; i < stars.size(); i++) {
            final var star = stars.get(i);
            result.add(star.withUseForAlignment(star.candidateMember() && updated.members().get(i))
                    .withLogProbability(updated.logProbabilities().get(i)));
        }
        log.info("Membership update selected {} alignment stars in {} rounds",
                result.stream().filter(Star::useForAlignment).count(), updated.rounds());
        return result;
    }

    private IterationDiagnostics diagnostics(final int iteration, final int framesUsed,
                                             final IterationState previous, final List<Star> stars,
                                             final EnsembleOffset offset) {
        final var mode = properties.getAveraging();
        final var absoluteKind = mode.absoluteKind();
        final var current = absoluteMotions(stars, absoluteKind);

        final var residualRa = current.entrySet().stream()
                .mapToDouble(e -> e.getValue().pmRa() - e.getKey().pmRa()).toArray();
        final var residualDec = current.entrySet().stream()
                .mapToDouble(e -> e.getValue().pmDec() - e.getKey().pmDec()).toArray();

        Double driftRa = null;
        Double driftDec = null;
        Double threshold = null;
        if (!previous.history().isEmpty()) {
            final var before = absoluteMotions(previous.stars(), absoluteKind).entrySet().stream()
                    .collect(Collectors.toMap(e -> e.getKey().sourceId(), Map.Entry::getValue));
            final var changeRa = new ArrayList<Double>();
            final var changeDec = new ArrayList<Double>();
            current.forEach((star, motion) -> {
                final var old = before.get(star.sourceId());
                if (old != null) {
                    changeRa.add(FastMath.abs(motion.pmRa() - old.pmRa()));
                    changeDec.add(FastMath.abs(motion.pmDec() - old.pmDec()));
                }
            });
            driftRa = mean(changeRa);
            driftDec = mean(changeDec);
            threshold = properties.getDriftThresholdFactor() * meanRelativeError(stars, mode);
        }

        return new IterationDiagnostics(iteration, framesUsed,
                (int) stars.stream().filter(Star::useForAlignment).count(),
                current.size(),
                driftRa, driftDec, threshold,
                spread(residualRa), spread(residualDec),
                offset.pmRa().value(mode), offset.pmDec().value(mode));
    }

    private TerminationReason checkConvergence(final IterationState previous, final List<Star> stars,
                                               final IterationDiagnostics diagnostics) {
        final var iterationsRun = diagnostics.iteration() + 1;
        switch (properties.getPolicy()) {
            case SINGLE_PASS:
                return TerminationReason.SINGLE_PASS;
            case MEMBERSHIP:
                final var alignment = stars.stream()
                        .filter(Star::useForAlignment)
                        .map(Star::sourceId)
                        .collect(Collectors.toUnmodifiableSet());
                if (diagnostics.iteration() > 0 && alignment.equals(previous.alignmentIds())) {
                    return TerminationReason.CONVERGED;
                }
                return capReached(iterationsRun, properties.getMembershipMaxIterations());
            case DRIFT:
            default:
                if (diagnostics.driftRa() != null
                        && diagnostics.driftRa() <= diagnostics.driftThreshold()
                        && diagnostics.driftDec() <= diagnostics.driftThreshold()) {
                    return TerminationReason.CONVERGED;
                }
                return capReached(iterationsRun, properties.getDriftMaxIterations());
        }
    }

    private static TerminationReason capReached(final int iterationsRun, final int cap) {
        if (iterationsRun >= FastMath.max(1, cap)) {
            log.warn("Max number of iterations ({}) reached without convergence. "
                    + "Please check the results carefully.", iterationsRun);
            return TerminationReason.ITERATION_CAP;
        }
        return null;
    }

    private static Map<Star, ProperMotion> absoluteMotions(final List<Star> stars,
                                                           final MeasurementKind kind) {
        final var result = new LinkedHashMap<Star, ProperMotion>();
        for (final var star : stars) {
            star.measurement(kind).filter(ProperMotion::isFinite).ifPresent(pm -> result.put(star, pm));
        }
        return result;
    }

    private static double meanRelativeError(final List<Star> stars, final AveragingMode mode) {
        final var raErrors = new ArrayList<Double>();
        final var decErrors = new ArrayList<Double>();
        for (final var star : stars) {
            star.measurement(mode.absoluteKind()).filter(ProperMotion::isFinite).ifPresent(absolute ->
                    star.measurement(mode.relativeKind()).ifPresent(relative -> {
                        if (Double.isFinite(relative.pmRaError())) {
                            raErrors.add(relative.pmRaError());
                        }
                        if (Double.isFinite(relative.pmDecError())) {
                            decErrors.add(relative.pmDecError());
                        }
                    }));
        }
        return 0.5 * (mean(raErrors) + mean(decErrors));
    }

    private static double mean(final List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    private static double spread(final double[] values) {
        return values.length == 0 ? Double.NaN : new StandardDeviation(false).evaluate(values);
    }
}
