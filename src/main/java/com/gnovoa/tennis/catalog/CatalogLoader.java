package com.gnovoa.tennis.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Team;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads leagues, facilities and teams from a JSON catalog into the store.
 *
 * <p>The location is a Spring resource string ({@code classpath:...}, {@code file:...}). The whole
 * document is validated before anything is stored, so a bad file leaves the store untouched.
 */
@Component
public final class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper mapper;
    private final ResourceLoader resources;
    private final LeagueDataStore store;

    public CatalogLoader(ObjectMapper mapper, ResourceLoader resources, LeagueDataStore store) {
        this.mapper = mapper;
        this.resources = resources;
        this.store = store;
    }

    /**
     * Reads, validates and stores a catalog.
     *
     * @param location Spring resource location of the JSON document
     * @return the parsed document
     * @throws IllegalStateException if the file cannot be read or parsed
     * @throws IllegalArgumentException if the content is inconsistent (duplicate ids, dangling references)
     */
    public CatalogDocument load(String location) {
        Resource resource = resources.getResource(location);
        CatalogDocument doc;
        try (var in = resource.getInputStream()) {
            doc = mapper.readValue(in, CatalogDocument.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load catalog from " + location, e);
        }
        List<Facility> facilities = doc.facilities().stream().map(CatalogDocument.FacilityEntry::toFacility).toList();
        validate(doc, facilities, location);

        facilities.forEach(store::saveFacility);
        doc.leagues().forEach(store::saveLeague);
        doc.teams().forEach(store::saveTeam);
        log.info("Loaded catalog {}: {} league(s), {} facility(ies), {} team(s)",
                location, doc.leagues().size(), facilities.size(), doc.teams().size());
        return doc;
    }

    private void validate(CatalogDocument doc, List<Facility> facilities, String location) {
        Set<Long> facilityIds = uniqueIds(facilities.stream().map(Facility::id).toList(), "facility", location);
        Set<Long> leagueIds = uniqueIds(doc.leagues().stream().map(League::id).toList(), "league", location);
        uniqueIds(doc.teams().stream().map(Team::id).toList(), "team", location);

        for (Team t : doc.teams()) {
            if (!leagueIds.contains(t.leagueId()) && store.league(t.leagueId()).isEmpty()) {
                throw new IllegalArgumentException("Team " + t.name() + " refers to unknown league "
                        + t.leagueId() + " (catalog " + location + ")");
            }
            if (!facilityIds.contains(t.homeFacilityId()) && store.facility(t.homeFacilityId()).isEmpty()) {
                throw new IllegalArgumentException("Team " + t.name() + " refers to unknown facility "
                        + t.homeFacilityId() + " (catalog " + location + ")");
            }
        }
        for (Facility f : facilities) {
            f.schedule().days().forEach((day, slots) -> slots.forEach(s -> {
                if (s.availableCourts() > f.totalCourts()) {
                    log.warn("Facility {} offers {} courts at {} {} but has only {} in total",
                            f.name(), s.availableCourts(), day, s.time(), f.totalCourts());
                }
            }));
        }
    }

    private static Set<Long> uniqueIds(List<Long> ids, String what, String location) {
        Set<Long> seen = new HashSet<>();
        for (long id : ids) {
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate " + what + " id " + id + " (catalog " + location + ")");
            }
        }
        return seen;
    }
}
