package io.github.jakubt4.pmfusion.controller;

import io.github.jakubt4.pmfusion.client.CatalogUnavailableException;
import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.dto.RefinementRequest;
import io.github.jakubt4.pmfusion.dto.RefinementResponse;
import io.github.jakubt4.pmfusion.dto.StarResultRow;
import io.github.jakubt4.pmfusion.dto.StarRow;
import io.github.jakubt4.pmfusion.model.FrameDescriptor;
import io.github.jakubt4.pmfusion.model.Star;
import io.github.jakubt4.pmfusion.model.TerminationReason;
import io.github.jakubt4.pmfusion.service.AlignmentException;
import io.github.jakubt4.pmfusion.service.CatalogPreparationService;
import io.github.jakubt4.pmfusion.service.ConvergenceController;
import io.github.jakubt4.pmfusion.service.EpochConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoint running a proper-motion refinement job.
 *
 * <p>Accepts reference stars (inline or as an archive region) and first-epoch frames via
 * {@code POST /api/pm/refine} and returns the refined motions with the convergence series.
 */
@Slf4j
@RestController
@RequestMapping("/api/pm")
@RequiredArgsConstructor
public class ProperMotionController {

    private final ConvergenceController convergenceController;
    private final CatalogPreparationService catalogPreparationService;
    private final EpochConverter epochConverter;
    private final AlignmentProperties properties;

    /**
     * Runs the refinement to termination.
     *
     * @param request reference stars or region, and frames
     * @return {@code 200 OK} with CONVERGED, MAX_ITERATIONS or NO_USABLE_FRAMES status, {@code 400 Bad Request} on
     *         malformed input, {@code 422 Unprocessable Entity} when no frame can be aligned and
     *         {@code 503 Service Unavailable} when the archive cannot be reached
     */
    @PostMapping("/refine")
    public ResponseEntity<RefinementResponse> refine(@RequestBody final RefinementRequest request) {
        if (request.frames() == null || request.frames().isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(RefinementResponse.rejected("At least one frame is required"));
        }
        final var inlineStars = request.stars() != null && !request.stars().isEmpty();
        if (!inlineStars && request.region() == null) {
            return ResponseEntity.badRequest()
                    .body(RefinementResponse.rejected("Reference stars or a sky region are required"));
        }

        final List<FrameDescriptor> frames;
        try {
            frames = request.frames().stream()
                    .map(frame -> frame.toDescriptor(epochConverter))
                    .toList();
        } catch (final IllegalArgumentException e) {
            log.warn("Rejected refinement request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(RefinementResponse.rejected("Invalid frame: " + e.getMessage()));
        }

        try {
            final List<Star> stars = inlineStars
                    ? request.stars().stream().map(StarRow::toStar).toList()
                    : catalogPreparationService.loadRegion(request.region());
            if (stars.isEmpty()) {
                return ResponseEntity.badRequest()
                        .body(RefinementResponse.rejected("No reference star with proper motion in the request"));
            }

            final var result = convergenceController.refine(stars, frames);
            final var status = status(result.termination());
            final var rows = result.stars().stream()
                    .map(star -> StarResultRow.of(star, properties.getAveraging()))
                    .toList();
            log.info("Refinement of {} frames finished with {} stars, status {}",
                    frames.size(), rows.size(), status);
            return ResponseEntity.ok(new RefinementResponse(status,
                    "Refined " + rows.size() + " stars in " + result.iterations() + " iterations",
                    result.iterations(), result.alignmentMotion(), rows, result.history()));
        } catch (final AlignmentException e) {
            log.error("Refinement failed: {}", e.getMessage());
            return ResponseEntity.unprocessableEntity()
                    .body(RefinementResponse.rejected(e.getMessage()));
        } catch (final CatalogUnavailableException e) {
            log.error("Refinement aborted: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(RefinementResponse.rejected(e.getMessage()));
        } catch (final IllegalArgumentException e) {
            log.warn("Rejected refinement request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(RefinementResponse.rejected("Invalid input: " + e.getMessage()));
        }
    }

    private static String status(final TerminationReason termination) {
        return switch (termination) {
            case ITERATION_CAP -> "MAX_ITERATIONS";
            case NO_USABLE_FRAMES -> "NO_USABLE_FRAMES";
            case CONVERGED, SINGLE_PASS -> "CONVERGED";
        };
    }
}
