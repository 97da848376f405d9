package dev.aparikh.emailtriage.triage;

import dev.aparikh.emailtriage.config.TriageProperties;
import dev.aparikh.emailtriage.indexing.EmailIndexService;
import dev.aparikh.emailtriage.indexing.EmailUpdate;
import dev.aparikh.emailtriage.model.EmailDocument;
import dev.aparikh.emailtriage.search.EmailSearchService;
import dev.aparikh.emailtriage.search.SearchQuery;
import dev.aparikh.emailtriage.search.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Batch operations over stored emails: categorize a window of mail, or rank it into a priority
 * inbox. Classification calls run concurrently up to {@code triage.classification.parallelism};
 * results keep the order of the store query, so ranking never depends on which call finished first.
 */
@Service
public class TriageService {

    private static final Logger log = LoggerFactory.getLogger(TriageService.class);

    static final Comparator<TriagedEmail> BY_PRIORITY = Comparator
            .comparingInt(TriagedEmail::score).reversed()
            .thenComparing(t -> t.email().sentAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(t -> t.email().id(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final EmailSearchService searchService;
    private final EmailIndexService indexService;
    private final EmailCategorizer categorizer;
    private final PriorityScorer scorer;
    private final TriageProperties properties;

    public TriageService(EmailSearchService searchService, EmailIndexService indexService,
                         EmailCategorizer categorizer, PriorityScorer scorer, TriageProperties properties) {
        this.searchService = searchService;
        this.indexService = indexService;
        this.categorizer = categorizer;
        this.scorer = scorer;
        this.properties = properties;
    }

    public List<TriagedEmail> categorize(CategorizeRequest request) {
        SearchQuery query = SearchQuery.builder()
                .dateFrom(request.dateFrom())
                .dateTo(request.dateTo())
                .maxResults(request.maxResults())
                .sort(SortOrder.NEWEST_FIRST)
                .build();
        List<EmailDocument> emails = searchService.search(query);

        List<TriagedEmail> categorized = classifyAll(emails, request.timeout(),
                (email, result) -> new TriagedEmail(email, result, null));

        List<TriagedEmail> kept = categorized.stream()
                .filter(t -> request.category() == null || t.category().category() == request.category())
                .toList();
        if (request.persist()) {
            kept.forEach(t -> indexService.update(t.email().id(),
                    EmailUpdate.triage(t.category().category().tag(), null)));
        }
        log.info("Categorized {} emails, {} kept", emails.size(), kept.size());
        return kept;
    }

    public List<TriagedEmail> priorityInbox(PriorityInboxRequest request) {
        int pool = Math.max(properties.getPriorityInbox().getCandidatePoolSize(), request.maxResults());
        SearchQuery query = SearchQuery.builder()
                .dateFrom(request.dateFrom())
                .read(request.unreadOnly() ? Boolean.FALSE : null)
                .maxResults(pool)
                .sort(SortOrder.NEWEST_FIRST)
                .build();
        List<EmailDocument> candidates = searchService.search(query);

        List<TriagedEmail> ranked = classifyAll(candidates, request.timeout(),
                (email, result) -> new TriagedEmail(email, result, scorer.score(email, result)))
                .stream()
                .filter(t -> t.category().category() != Category.PROMOTIONAL
                        && t.category().category() != Category.SPAM)
                .filter(t -> request.minPriority() == null || t.priority().level().isAtLeast(request.minPriority()))
                .sorted(BY_PRIORITY)
                .limit(request.maxResults())
                .toList();

        if (request.persist()) {
            ranked.forEach(t -> indexService.update(t.email().id(),
                    EmailUpdate.triage(t.category().category().tag(), t.priority().level().tag())));
        }
        log.info("Priority inbox ranked {} of {} candidates", ranked.size(), candidates.size());
        return ranked;
    }

    /**
     * Categorizes and scores one stored email.
     *
     * @throws dev.aparikh.emailtriage.search.EmailNotFoundException if no email has this id
     */
    public TriagedEmail triage(String id) {
        EmailDocument email = searchService.getById(id);
        CategoryResult result = categorizer.categorize(email);
        return new TriagedEmail(email, result, scorer.score(email, result));
    }

    private List<TriagedEmail> classifyAll(List<EmailDocument> emails, Duration timeout,
                                            BiFunction<EmailDocument, CategoryResult, TriagedEmail> combiner) {
        if (emails.isEmpty()) return List.of();
        int parallelism = properties.getClassification().getParallelism();
        List<TriagedEmail> results = Flux.fromIterable(emails)
                .flatMapSequential(email -> categorizer.categorizeAsync(email, timeout)
                        .map(result -> combiner.apply(email, result)), parallelism)
                .collectList()
                .block();
        return results == null ? List.of() : results;
    }
}
