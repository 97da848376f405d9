package dev.aparikh.emailtriage.api;

import dev.aparikh.emailtriage.conversation.ConversationHistory;
import dev.aparikh.emailtriage.conversation.ConversationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
@Tag(name = "Conversations", description = "Email history with one contact, grouped by thread")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Conversation history with a contact",
            description = "Every email the contact sent, received, or was copied on, oldest first, grouped by " +
                    "thread. Each email is tagged with its direction relative to the contact."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "History assembled",
                    content = @Content(schema = @Schema(implementation = ConversationHistory.class))),
            @ApiResponse(responseCode = "400", description = "Missing contact or invalid maxResults",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Email store unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ConversationHistory> history(
            @Parameter(description = "Email address or fragment of the contact", example = "jane@acme.com", required = true)
            @RequestParam String contact,
            @Parameter(description = "Restrict to one thread")
            @RequestParam(required = false) String threadId,
            @Parameter(description = "Maximum number of emails", example = "100")
            @RequestParam(defaultValue = "" + ConversationService.DEFAULT_MAX_RESULTS)
            @Positive(message = "maxResults must be positive")
            @Max(value = 500, message = "maxResults must be at most 500") int maxResults) {

        return ResponseEntity.ok(conversationService.history(contact, threadId, maxResults));
    }
}
