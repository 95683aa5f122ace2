package com.newswebsite.service;

import com.newswebsite.dto.EventRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.Event;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.repository.EventRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class EventService {

    private static final Logger LOG = LogManager.getLogger(EventService.class);

    private static final String RESOURCE = "Event";
    static final Map<String, String> SORT_FIELDS = Map.of(
            "date", "date",
            "createdAt", "createdAt",
            "title", "title");

    private final EventRepository eventRepository;

    public EventService(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    /**
     * {@code upcoming} wins over {@code past} when both are "true".
     */
    public PageResult<Event> list(PageQuery query, String active, String upcoming, String past) {
        LocalDateTime now = LocalDateTime.now();
        boolean onlyUpcoming = Boolean.TRUE.equals(Specs.flag(upcoming));
        boolean onlyPast = !onlyUpcoming && Boolean.TRUE.equals(Specs.flag(past));

        Specification<Event> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "title", "description", "location"),
                Specs.equal("isActive", Specs.flag(active)),
                onlyUpcoming ? Specs.onOrAfter("date", now) : null,
                onlyPast ? Specs.before("date", now) : null);
        return PageResult.of("events",
                eventRepository.findAll(spec, query.toPageable(SORT_FIELDS, "date", Sort.Direction.ASC)), query);
    }

    public PageResult<Event> listPublic(PageQuery query) {
        Specification<Event> spec = Specs.equal("isActive", Boolean.TRUE);
        return PageResult.of("events",
                eventRepository.findAll(spec, query.toPageable(Map.of(), "date", Sort.Direction.ASC)), query);
    }

    public Event get(Long id, boolean includeInactive) {
        return eventRepository.findById(id)
                .filter(event -> includeInactive || Boolean.TRUE.equals(event.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    @Transactional
    public Event create(EventRequest request) {
        Inputs.requireAll("Please provide title, description and date",
                request.getTitle(), request.getDescription(), request.getDate());

        Event event = new Event();
        event.setTitle(request.getTitle());
        event.setDescription(request.getDescription());
        event.setDate(Inputs.parseDate(request.getDate(), "date"));
        event.setLocation(request.getLocation());
        event.setIsOnline(request.getIsOnline() != null ? request.getIsOnline() : Boolean.FALSE);
        event.setImageUrl(request.getImageUrl());
        event.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        Event saved = eventRepository.save(event);
        LOG.info("Created event {}", saved.getId());
        return saved;
    }

    @Transactional
    public Event update(Long id, EventRequest request) {
        Event event = get(id, true);
        if (request.getTitle() != null) {
            event.setTitle(Inputs.requireNotBlank(request.getTitle(), "title"));
        }
        if (request.getDescription() != null) {
            event.setDescription(Inputs.requireNotBlank(request.getDescription(), "description"));
        }
        if (request.getDate() != null) {
            event.setDate(Inputs.parseDate(request.getDate(), "date"));
        }
        if (request.getLocation() != null) {
            event.setLocation(request.getLocation());
        }
        if (request.getIsOnline() != null) {
            event.setIsOnline(request.getIsOnline());
        }
        if (request.getImageUrl() != null) {
            event.setImageUrl(request.getImageUrl());
        }
        if (request.getIsActive() != null) {
            event.setIsActive(request.getIsActive());
        }
        return eventRepository.save(event);
    }

    @Transactional
    public Event toggleActive(Long id) {
        if (eventRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Map<String, Object> delete(Long id) {
        Event event = get(id, true);
        eventRepository.delete(event);
        LOG.info("Deleted event {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", event.getId());
        deleted.put("title", event.getTitle());
        return deleted;
    }
}
