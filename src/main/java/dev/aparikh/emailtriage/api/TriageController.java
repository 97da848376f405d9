package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.triage.CategorizeRequest;
import dev.aparikh.emailtriage.triage.Category;
import dev.aparikh.emailtriage.triage.PriorityInboxRequest;
import dev.aparikh.emailtriage.triage.PriorityLevel;
import dev.aparikh.emailtriage.triage.TriageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Batch categorization and the priority inbox.
 */
@RestController
@RequestMapping("/api/triage")
@Tag(name = "Triage", description = "Categorize emails and rank them by urgency")
public class TriageController {

    private final TriageService triageService;

    public TriageController(TriageService triageService) {
        this.triageService = triageService;
    }

    @PostMapping(value = "/categorize", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Categorize emails",
            description = "Classifies the newest emails in the date window, optionally keeping only one category " +
                    "(for example payment_request_external) and writing the result back to the store."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Emails categorized",
                    content = @Content(schema = @Schema(implementation = TriageResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameters or unknown category",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Email store unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<TriageResponse> categorize(@Valid @RequestBody CategorizeEmailsRequest request) {
        Category category = request.category() == null || request.category().isBlank() ? null
                : Category.fromTag(request.category())
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + request.category()));
        CategorizeRequest categorize = new CategorizeRequest(
                request.dateFrom(),
                request.dateTo(),
                category,
                request.maxResults() != null ? request.maxResults() : CategorizeRequest.DEFAULT_MAX_RESULTS,
                timeout(request.timeoutSeconds()),
                Boolean.TRUE.equals(request.persist())
        );
        return ResponseEntity.ok(TriageResponse.of(triageService.categorize(categorize)));
    }

    @PostMapping(value = "/priority-inbox", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Priority inbox",
            description = "Scores recent emails 0-100 and returns the most urgent first. Promotions and spam " +
                    "are left out. Each entry lists the reasons behind its score."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Inbox ranked",
                    content = @Content(schema = @Schema(implementation = TriageResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameters or unknown priority level",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Email store unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<TriageResponse> priorityInbox(@Valid @RequestBody PriorityInboxApiRequest request) {
        PriorityLevel minPriority = request.minPriority() == null || request.minPriority().isBlank() ? null
                : PriorityLevel.fromTag(request.minPriority())
                .orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + request.minPriority()));
        PriorityInboxRequest inbox = new PriorityInboxRequest(
                request.dateFrom(),
                Boolean.TRUE.equals(request.unreadOnly()),
                minPriority,
                request.maxResults() != null ? request.maxResults() : PriorityInboxRequest.DEFAULT_MAX_RESULTS,
                timeout(request.timeoutSeconds()),
                Boolean.TRUE.equals(request.persist())
        );
        return ResponseEntity.ok(TriageResponse.of(triageService.priorityInbox(inbox)));
    }

    private static Duration timeout(Integer seconds) {
        return seconds == null ? null : Duration.ofSeconds(seconds);
    }
}
