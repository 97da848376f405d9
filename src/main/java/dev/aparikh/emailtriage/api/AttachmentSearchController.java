package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.attachment.AttachmentSearchHit;
import dev.aparikh.emailtriage.attachment.AttachmentSearchQuery;
import dev.aparikh.emailtriage.attachment.AttachmentSearchService;
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

import java.util.List;

@RestController
@RequestMapping("/api/attachments")
@Tag(name = "Attachments", description = "Search inside attachment text and file names")
public class AttachmentSearchController {

    private final AttachmentSearchService attachmentSearchService;

    public AttachmentSearchController(AttachmentSearchService attachmentSearchService) {
        this.attachmentSearchService = attachmentSearchService;
    }

    @PostMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Search attachment content",
            description = "Finds emails whose relevant attachments contain the phrase. Signature images, logos " +
                    "and other decorative files are ignored. Content matches rank above file name matches."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Search completed",
                    content = @Content(schema = @Schema(implementation = AttachmentSearchResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing phrase or invalid maxResults",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Email store unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<AttachmentSearchResponse> search(@Valid @RequestBody AttachmentSearchRequest request) {
        AttachmentSearchQuery query = new AttachmentSearchQuery(
                request.text(),
                request.fileType(),
                request.sender(),
                request.dateFrom(),
                request.maxResults() != null ? request.maxResults() : AttachmentSearchQuery.DEFAULT_MAX_RESULTS,
                Boolean.TRUE.equals(request.includeBodyMatches())
        );
        List<AttachmentSearchHit> hits = attachmentSearchService.search(query);
        return ResponseEntity.ok(new AttachmentSearchResponse(request.text(), hits.size(), hits));
    }
}
