package com.newswebsite.service;

import com.newswebsite.dto.EventRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.FestivalEvent;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.repository.FestivalEventRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class FestivalEventService {

    private static final Logger LOG = LogManager.getLogger(FestivalEventService.class);

    private static final String RESOURCE = "Festival event";
    static final int DEFAULT_PUBLIC_LIMIT = 3;
    static final Map<String, String> SORT_FIELDS = Map.of(
            "date", "date",
            "createdAt", "createdAt",
            "title", "title");

    private final FestivalEventRepository festivalEventRepository;

    public FestivalEventService(FestivalEventRepository festivalEventRepository) {
        this.festivalEventRepository = festivalEventRepository;
    }

    /**
     * {@code dateFrom} and {@code dateTo} are inclusive and narrow whatever
     * {@code upcoming} or {@code past} already selected. {@code upcoming} wins over
     * {@code past} when both are "true".
     */
    public PageResult<FestivalEvent> list(PageQuery query, String active, String upcoming, String past,
                                          String dateFrom, String dateTo) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime from = Inputs.isBlank(dateFrom) ? null : Inputs.parseDate(dateFrom, "dateFrom");
        LocalDateTime to = Inputs.isBlank(dateTo) ? null : Inputs.parseDate(dateTo, "dateTo");
        boolean onlyUpcoming = Boolean.TRUE.equals(Specs.flag(upcoming));
        boolean onlyPast = !onlyUpcoming && Boolean.TRUE.equals(Specs.flag(past));

        Specification<FestivalEvent> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "title", "description", "location"),
                Specs.equal("isActive", Specs.flag(active)),
                onlyUpcoming ? Specs.onOrAfter("date", now) : null,
                onlyPast ? Specs.before("date", now) : null,
                Specs.onOrAfter("date", from),
                Specs.onOrBefore("date", to));
        return PageResult.of("festivalEvents",
                festivalEventRepository.findAll(spec, query.toPageable(SORT_FIELDS, "date", Sort.Direction.ASC)), query);
    }

    /**
     * Next active festival events, soonest first.
     */
    public List<FestivalEvent> listPublic(Integer limit) {
        int size = limit == null || limit < 1 ? DEFAULT_PUBLIC_LIMIT : limit;
        return festivalEventRepository.findByIsActiveTrueAndDateGreaterThanEqualOrderByDateAsc(
                LocalDateTime.now(), PageRequest.of(0, size));
    }

    public FestivalEvent get(Long id, boolean includeInactive) {
        return festivalEventRepository.findById(id)
                .filter(event -> includeInactive || Boolean.TRUE.equals(event.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    @Transactional
    public FestivalEvent create(EventRequest request) {
        Inputs.requireAll("Please provide title, description, and date",
                request.getTitle(), request.getDescription(), request.getDate());

        FestivalEvent event = new FestivalEvent();
        event.setTitle(request.getTitle());
        event.setDescription(request.getDescription());
        event.setDate(Inputs.parseDate(request.getDate(), "date"));
        event.setLocation(request.getLocation());
        event.setIsOnline(request.getIsOnline() != null ? request.getIsOnline() : Boolean.FALSE);
        event.setImageUrl(request.getImageUrl());
        event.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        FestivalEvent saved = festivalEventRepository.save(event);
        LOG.info("Created festival event {}", saved.getId());
        return saved;
    }

    @Transactional
    public FestivalEvent update(Long id, EventRequest request) {
        FestivalEvent event = get(id, true);
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
        return festivalEventRepository.save(event);
    }

    @Transactional
    public FestivalEvent toggleActive(Long id) {
        if (festivalEventRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Map<String, Object> delete(Long id) {
        FestivalEvent event = get(id, true);
        festivalEventRepository.delete(event);
        LOG.info("Deleted festival event {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", event.getId());
        deleted.put("title", event.getTitle());
        return deleted;
    }
}
