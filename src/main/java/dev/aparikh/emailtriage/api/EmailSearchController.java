package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.indexing.EmailIndexService;
import dev.aparikh.emailtriage.indexing.EmailUpdate;
import dev.aparikh.emailtriage.model.EmailDocument;
import dev.aparikh.emailtriage.search.EmailSearchService;
import dev.aparikh.emailtriage.search.SearchQuery;
import dev.aparikh.emailtriage.triage.Category;
import dev.aparikh.emailtriage.triage.PriorityLevel;
import dev.aparikh.emailtriage.triage.TriageService;
import dev.aparikh.emailtriage.triage.TriagedEmail;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for email search, single-email triage and updates.
 */
@RestController
@RequestMapping("/api/emails")
@Tag(name = "Emails", description = "Email search, hit count, triage and partial update operations")
public class EmailSearchController {

    private final EmailSearchService emailSearchService;
    private final EmailIndexService emailIndexService;
    private final TriageService triageService;

    public EmailSearchController(EmailSearchService emailSearchService, EmailIndexService emailIndexService,
                                 TriageService triageService) {
        this.emailSearchService = emailSearchService;
        this.emailIndexService = emailIndexService;
        this.triageService = triageService;
    }

    @PostMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Search emails",
            description = "Search emails by free text, sender, recipient, category, date range, attachments, " +
                    "labels and read state. Dates accept yyyy-MM-dd or phrases such as 'yesterday' or " +
                    "'last 3 days'. Results are newest first unless sort says otherwise."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Search completed successfully",
                    content = @Content(schema = @Schema(implementation = SearchResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid search parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Email store unavailable or query rejected",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<SearchResponse> searchEmails(
            @Parameter(description = "Search request parameters", required = true)
            @Valid @RequestBody SearchRequest request) {

        SearchQuery query = toSearchQuery(request);
        List<EmailDocument> emails = emailSearchService.search(query);
        long totalCount = emailSearchService.count(query);

        return ResponseEntity.ok(new SearchResponse(emails, emails.size(), totalCount));
    }

    @PostMapping(value = "/count", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Get hit count",
            description = "Count the emails matching the search criteria without returning them."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Count retrieved successfully",
                    content = @Content(schema = @Schema(implementation = HitCountResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid search parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Email store unavailable or query rejected",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<HitCountResponse> getHitCount(
            @Parameter(description = "Search request parameters for counting", required = true)
            @Valid @RequestBody SearchRequest request) {

        long count = emailSearchService.count(toSearchQuery(request));
        return ResponseEntity.ok(new HitCountResponse(count));
    }

    @GetMapping(value = "/{id}/triage", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Categorize and score one email",
            description = "Classifies the stored email and computes its priority score with the reasons behind it. " +
                    "If classification fails or times out the email is treated as general correspondence."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Email triaged",
                    content = @Content(schema = @Schema(implementation = TriagedEmail.class))),
            @ApiResponse(responseCode = "404", description = "No email with this id",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<TriagedEmail> triage(@PathVariable String id) {
        return ResponseEntity.ok(triageService.triage(id));
    }

    @PatchMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Update one email",
            description = "Sets read, starred or important flags, replaces labels, or records a category and " +
                    "priority. Omitted fields are left unchanged."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Email updated"),
            @ApiResponse(responseCode = "400", description = "Empty update or unknown category/priority",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "No email with this id",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<Void> updateEmail(@PathVariable String id, @RequestBody EmailUpdateRequest request) {
        String category = request.category() == null ? null : Category.fromTag(request.category())
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + request.category()))
                .tag();
        String priority = request.priority() == null ? null : PriorityLevel.fromTag(request.priority())
                .orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + request.priority()))
                .tag();
        emailIndexService.update(id, new EmailUpdate(request.read(), request.starred(), request.important(),
                request.labels(), category, priority));
        return ResponseEntity.noContent().build();
    }

    static SearchQuery toSearchQuery(SearchRequest request) {
        return SearchQuery.builder()
                .text(request.text())
                .sender(request.sender())
                .recipient(request.recipient())
                .category(request.category())
                .dateFrom(request.dateFrom())
                .dateTo(request.dateTo())
                .hasAttachments(request.hasAttachments())
                .labels(request.labels())
                .read(request.read())
                .maxResults(request.maxResults())
                .sort(request.sort())
                .build();
    }
}
