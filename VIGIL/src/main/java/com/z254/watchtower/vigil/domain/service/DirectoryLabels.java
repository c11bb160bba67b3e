package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.*;
import com.z254.watchtower.vigil.domain.repository.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only access to teams, services, users, categories and tags.
 * <p>
 * Resolves display labels in batches and checks that ids referenced by incident input exist.
 * Label maps only contain ids that were found; callers fall back to the raw id.
 */
@Component
public class DirectoryLabels {

    private final TeamRepository teamRepository;
    private final CatalogServiceRepository catalogServiceRepository;
    private final UserAccountRepository userAccountRepository;
    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;

    public DirectoryLabels(TeamRepository teamRepository,
                           CatalogServiceRepository catalogServiceRepository,
                           UserAccountRepository userAccountRepository,
                           CategoryRepository categoryRepository,
                           TagRepository tagRepository) {
        this.teamRepository = teamRepository;
        this.catalogServiceRepository = catalogServiceRepository;
        this.userAccountRepository = userAccountRepository;
        this.categoryRepository = categoryRepository;
        this.tagRepository = tagRepository;
    }

    // ========== Labels ==========

    public Map<String, String> teamLabels(Collection<String> ids) {
        return labels(ids, teamRepository::findAllById, Team::getId, Team::getName);
    }

    public Map<String, String> serviceLabels(Collection<String> ids) {
        return labels(ids, catalogServiceRepository::findAllById, CatalogService::getId, CatalogService::displayLabel);
    }

    public Map<String, String> userLabels(Collection<String> ids) {
        return labels(ids, userAccountRepository::findAllById, UserAccount::getId, UserAccount::displayLabel);
    }

    public Map<String, String> categoryLabels(Collection<String> ids) {
        return labels(ids, categoryRepository::findAllById, Category::getId, Category::getName);
    }

    public Map<String, String> tagLabels(Collection<String> ids) {
        return labels(ids, tagRepository::findAllById, Tag::getId, Tag::getLabel);
    }

    public String userLabel(String userId) {
        if (userId == null) {
            return null;
        }
        return userAccountRepository.findById(userId).map(UserAccount::displayLabel).orElse(userId);
    }

    public String teamLabel(String teamId) {
        if (teamId == null) {
            return null;
        }
        return teamRepository.findById(teamId).map(Team::getName).orElse(teamId);
    }

    // ========== Reference checks ==========

    /**
     * @return the id when it names an existing team, null when {@code teamId} is null
     */
    public String requireTeam(String teamId) {
        if (teamId == null) {
            return null;
        }
        if (!teamRepository.existsById(teamId)) {
            throw new RequestValidationException("Unknown team: " + teamId);
        }
        return teamId;
    }

    public String requireUser(String userId) {
        if (userId == null) {
            return null;
        }
        if (!userAccountRepository.existsById(userId)) {
            throw new RequestValidationException("Unknown user: " + userId);
        }
        return userId;
    }

    /**
     * Look a service up by id, or by key when no id is given.
     */
    public Optional<CatalogService> resolveService(String serviceId, String serviceKey) {
        if (serviceId != null && !serviceId.isBlank()) {
            return Optional.of(catalogServiceRepository.findById(serviceId)
                    .orElseThrow(() -> new RequestValidationException("Unknown service: " + serviceId)));
        }
        if (serviceKey != null && !serviceKey.isBlank()) {
            return Optional.of(catalogServiceRepository.findByKey(serviceKey.trim())
                    .orElseThrow(() -> new RequestValidationException("Unknown service key: " + serviceKey)));
        }
        return Optional.empty();
    }

    public Optional<String> findServiceIdByKey(String serviceKey) {
        return catalogServiceRepository.findByKey(serviceKey).map(CatalogService::getId);
    }

    public Set<String> requireCategories(Collection<String> categoryIds) {
        return requireAll(categoryIds, categoryRepository::findAllById, Category::getId, "category");
    }

    public Set<String> requireTags(Collection<String> tagIds) {
        return requireAll(tagIds, tagRepository::findAllById, Tag::getId, "tag");
    }

    private <T> Set<String> requireAll(Collection<String> ids, Function<Iterable<String>, List<T>> loader,
                                       Function<T, String> idOf, String kind) {
        if (ids == null || ids.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Set<String> requested = new LinkedHashSet<>(ids);
        Set<String> found = loader.apply(requested).stream().map(idOf).collect(Collectors.toSet());
        List<String> missing = requested.stream().filter(id -> !found.contains(id)).toList();
        if (!missing.isEmpty()) {
            throw new RequestValidationException("Unknown " + kind + "(s): " + String.join(", ", missing));
        }
        return requested;
    }

    private <T> Map<String, String> labels(Collection<String> ids, Function<Iterable<String>, List<T>> loader,
                                           Function<T, String> idOf, Function<T, String> labelOf) {
        Set<String> wanted = ids == null ? Set.of() : ids.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (wanted.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new HashMap<>();
        for (T entity : loader.apply(wanted)) {
            result.put(idOf.apply(entity), labelOf.apply(entity));
        }
        return result;
    }
}
