package com.example.meetingscheduler.resolver;

import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.ParticipantMatch;
import com.example.meetingscheduler.util.EmailAddresses;
import com.example.meetingscheduler.util.TextCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps the name and email tokens of a request onto directory identities.
 *
 * <p>Emails are resolved first, then names, each group in input order. Name candidates are ranked by
 * {@link NameMatchType}; within one rank the directory order is kept.
 */
public class EntityResolver {

    private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

    public static final int MAX_CANDIDATES = 10;

    public List<ParticipantMatch> resolve(List<String> names, List<String> emails, ParticipantDirectory directory) {
        List<ParticipantMatch> matches = new ArrayList<>();
        for (String email : emails) {
            resolveEmail(email, directory).ifPresent(matches::add);
        }
        for (String name : names) {
            resolveName(name, directory).ifPresent(matches::add);
        }
        return matches;
    }

    public Optional<ParticipantMatch> resolveEmail(String email, ParticipantDirectory directory) {
        if (!EmailAddresses.isValid(email)) {
            logger.debug("Skipping malformed email query '{}'", email);
            return Optional.empty();
        }
        String trimmed = email.trim();
        Optional<ParticipantIdentity> known = directory.getByEmail(trimmed);
        if (known.isPresent()) {
            return Optional.of(new ParticipantMatch(email, new ArrayList<>(List.of(known.get())), 1.0, true, true));
        }
        // valid but unknown: offer a synthesized identity the user can still confirm
        ParticipantIdentity synthesized = new ParticipantIdentity(trimmed,
                EmailAddresses.displayNameFromEmail(trimmed), null, null, AvailabilityStatus.UNKNOWN);
        return Optional.of(new ParticipantMatch(email, new ArrayList<>(List.of(synthesized)), 0.8, false, true));
    }

    public Optional<ParticipantMatch> resolveName(String name, ParticipantDirectory directory) {
        if (name == null || name.trim().length() <= 1) {
            return Optional.empty();
        }
        String query = TextCase.normalize(name);

        List<Ranked> ranked = new ArrayList<>();
        for (ParticipantIdentity identity : directory.listParticipants()) {
            NameMatchType type = classify(query, TextCase.normalize(identity.getDisplayName()));
            if (type != null) {
                ranked.add(new Ranked(identity, type));
            }
        }
        // List.sort is stable, so equal ranks keep directory order
        ranked.sort(Comparator.comparing(Ranked::type));

        Map<String, Ranked> unique = new LinkedHashMap<>();
        for (Ranked r : ranked) {
            if (unique.size() == MAX_CANDIDATES) {
                break;
            }
            unique.putIfAbsent(TextCase.normalize(r.identity().getEmail()), r);
        }
        List<Ranked> kept = new ArrayList<>(unique.values());
        List<ParticipantIdentity> candidates = kept.stream().map(Ranked::identity).toList();

        double confidence = kept.isEmpty() ? 0.0 : confidence(kept.get(0), kept.size(), query);
        boolean exact = candidates.size() == 1
                && TextCase.normalize(candidates.get(0).getDisplayName()).equals(query);

        logger.debug("Name '{}' resolved to {} candidate(s), confidence {}", name, candidates.size(), confidence);
        return Optional.of(new ParticipantMatch(name, new ArrayList<>(candidates), confidence, exact, false));
    }

    /**
     * Autocomplete for a partially typed name or email.
     */
    public List<ParticipantIdentity> suggest(String partial, int limit, ParticipantDirectory directory) {
        if (partial == null || partial.isBlank()) {
            return List.of();
        }
        return directory.search(partial.trim(), limit);
    }

    /**
     * First cascade rule the directory name satisfies, or null when nothing matches.
     */
    static NameMatchType classify(String query, String fullName) {
        if (fullName.isEmpty()) {
            return null;
        }
        String[] parts = fullName.split(" ");
        if (fullName.equals(query)) {
            return NameMatchType.EXACT;
        }
        if (parts[0].equals(query)) {
            return NameMatchType.FIRST_NAME;
        }
        if (parts.length > 1 && parts[parts.length - 1].equals(query)) {
            return NameMatchType.LAST_NAME;
        }
        if (fullName.contains(query) || query.contains(fullName)) {
            return NameMatchType.SUBSTRING;
        }
        for (String queryToken : query.split(" ")) {
            for (String part : parts) {
                if (part.contains(queryToken) || queryToken.contains(part)) {
                    return NameMatchType.TOKEN_OVERLAP;
                }
            }
        }
        return null;
    }

    private static double confidence(Ranked best, int candidateCount, String query) {
        boolean single = candidateCount == 1;
        return switch (best.type()) {
            case EXACT -> 1.0;
            case FIRST_NAME -> single ? 0.9 : 0.7;
            case LAST_NAME -> single ? 0.8 : 0.6;
            case SUBSTRING -> single ? 0.7 : 0.5;
            case TOKEN_OVERLAP -> Math.min(0.3 + 0.1 * sharedTokens(query, best.identity().getDisplayName()), 0.6);
        };
    }

    private static int sharedTokens(String query, String displayName) {
        Set<String> nameTokens = new HashSet<>(Arrays.asList(TextCase.normalize(displayName).split(" ")));
        return (int) Arrays.stream(query.split(" ")).distinct().filter(nameTokens::contains).count();
    }

    private record Ranked(ParticipantIdentity identity, NameMatchType type) {
    }
}
