package com.example.cvpipeline.service;

import com.example.cvpipeline.model.AchievementRef;
import com.example.cvpipeline.model.CandidateBullet;
import com.example.cvpipeline.model.RoleRecord;
import com.example.cvpipeline.model.StitchedDocument;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Citable corpus items of one draft, by citation id.
 * <ul>
 *   <li>bullet id ({@code acme-2}): an included bullet</li>
 *   <li>{@code roleId#n}: a raw achievement</li>
 *   <li>role id ({@code acme}): the role heading facts (employer, title, period)</li>
 * </ul>
 * Bullets come first, so lookups that scan for evidence prefer what the reader actually sees.
 */
public final class EvidenceIndex {

    private final Map<String, String> bullets;
    private final Map<String, String> achievements;
    private final Map<String, String> roleFacts;

    private EvidenceIndex(Map<String, String> bullets, Map<String, String> achievements,
                          Map<String, String> roleFacts) {
        this.bullets = bullets;
        this.achievements = achievements;
        this.roleFacts = roleFacts;
    }

    public static EvidenceIndex of(StitchedDocument document, List<RoleRecord> roles) {
        Map<String, String> bullets = new LinkedHashMap<>();
        for (CandidateBullet bullet : document.allBullets()) {
            bullets.put(bullet.id(), bullet.text());
        }
        Map<String, String> achievements = new LinkedHashMap<>();
        Map<String, String> roleFacts = new LinkedHashMap<>();
        for (RoleRecord role : roles) {
            for (int i = 1; i <= role.achievements().size(); i++) {
                achievements.put(new AchievementRef(role.roleId(), i).citationId(), role.achievements().get(i - 1));
            }
            roleFacts.put(role.roleId(), role.employer() + " " + role.title() + " " + role.period());
        }
        return new EvidenceIndex(bullets, achievements, roleFacts);
    }

    public Optional<String> resolve(String citationId) {
        if (citationId == null) return Optional.empty();
        String id = citationId.strip();
        if (bullets.containsKey(id)) return Optional.of(bullets.get(id));
        if (achievements.containsKey(id)) return Optional.of(achievements.get(id));
        return Optional.ofNullable(roleFacts.get(id));
    }

    /** Joined text of the given citations; unresolved ids are skipped. */
    public String textOf(List<String> citationIds) {
        return citationIds.stream()
                .map(this::resolve)
                .flatMap(Optional::stream)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Ids of bullets, then achievements, whose text contains the phrase as a whole word.
     */
    public List<String> evidenceFor(String phrase) {
        List<String> ids = bullets.entrySet().stream()
                .filter(e -> TextSimilarity.containsPhrase(e.getValue(), phrase))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        achievements.entrySet().stream()
                .filter(e -> TextSimilarity.containsPhrase(e.getValue(), phrase))
                .map(Map.Entry::getKey)
                .forEach(ids::add);
        return ids;
    }

    /** Citation catalogue for prompts, one item per line. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        bullets.forEach((id, text) -> sb.append('[').append(id).append("] ").append(text).append('\n'));
        achievements.forEach((id, text) -> sb.append('[').append(id).append("] ").append(text).append('\n'));
        roleFacts.forEach((id, text) -> sb.append('[').append(id).append("] ").append(text).append('\n'));
        return sb.toString();
    }
}
