package com.newswebsite.service;

import com.newswebsite.dto.FestivalHighlightRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.FestivalHighlight;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.repository.FestivalHighlightRepository;
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
public class FestivalHighlightService {

    private static final Logger LOG = LogManager.getLogger(FestivalHighlightService.class);

    private static final String RESOURCE = "Festival highlight";
    static final Map<String, String> SORT_FIELDS = Map.of(
            "order", "displayOrder",
            "title", "title",
            "createdAt", "createdAt",
            "updatedAt", "updatedAt");

    private final FestivalHighlightRepository highlightRepository;

    public FestivalHighlightService(FestivalHighlightRepository highlightRepository) {
        this.highlightRepository = highlightRepository;
    }

    /**
     * @param sort {@code field:direction}, e.g. {@code title:desc}; defaults to {@code order:asc}
     */
    public PageResult<FestivalHighlight> list(PageQuery query, String isActive, String sort) {
        Specification<FestivalHighlight> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "title", "content"),
                Specs.equal("isActive", Specs.flag(isActive)));

        String field = null;
        String direction = null;
        if (sort != null && !sort.isBlank()) {
            String[] parts = sort.split(":", 2);
            field = parts[0].trim();
            direction = parts.length > 1 ? parts[1].trim() : "asc";
        }
        PageQuery sorted = new PageQuery(query.getPage(), query.getLimit(), query.getSearch(), field, direction);
        Sort order = sorted.toSort(SORT_FIELDS, "displayOrder", Sort.Direction.ASC);

        return PageResult.of("highlights",
                highlightRepository.findAll(spec, PageRequest.of(query.getPage() - 1, query.getLimit(), order)), query);
    }

    public List<FestivalHighlight> listPublic() {
        return highlightRepository.findByIsActiveTrueOrderByDisplayOrderAsc();
    }

    public FestivalHighlight get(Long id, boolean includeInactive) {
        return highlightRepository.findById(id)
                .filter(highlight -> includeInactive || Boolean.TRUE.equals(highlight.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    @Transactional
    public FestivalHighlight create(FestivalHighlightRequest request) {
        Inputs.requireAll("Please provide title, content and icon",
                request.getTitle(), request.getContent(), request.getIcon());

        // colours left null pick up the entity defaults on persist
        FestivalHighlight highlight = new FestivalHighlight();
        highlight.setTitle(request.getTitle());
        highlight.setContent(request.getContent());
        highlight.setIcon(request.getIcon());
        highlight.setBgColor(request.getBgColor());
        highlight.setHoverBg(request.getHoverBg());
        highlight.setBorderColor(request.getBorderColor());
        highlight.setTextColor(request.getTextColor());
        highlight.setDisplayOrder(request.getOrder() != null ? request.getOrder() : 0);
        highlight.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        FestivalHighlight saved = highlightRepository.save(highlight);
        LOG.info("Created festival highlight {}", saved.getId());
        return saved;
    }

    @Transactional
    public FestivalHighlight update(Long id, FestivalHighlightRequest request) {
        FestivalHighlight highlight = get(id, true);
        if (request.getTitle() != null) {
            highlight.setTitle(Inputs.requireNotBlank(request.getTitle(), "title"));
        }
        if (request.getContent() != null) {
            highlight.setContent(Inputs.requireNotBlank(request.getContent(), "content"));
        }
        if (request.getIcon() != null) {
            highlight.setIcon(Inputs.requireNotBlank(request.getIcon(), "icon"));
        }
        if (request.getBgColor() != null) {
            highlight.setBgColor(request.getBgColor());
        }
        if (request.getHoverBg() != null) {
            highlight.setHoverBg(request.getHoverBg());
        }
        if (request.getBorderColor() != null) {
            highlight.setBorderColor(request.getBorderColor());
        }
        if (request.getTextColor() != null) {
            highlight.setTextColor(request.getTextColor());
        }
        if (request.getOrder() != null) {
            highlight.setDisplayOrder(request.getOrder());
        }
        if (request.getIsActive() != null) {
            highlight.setIsActive(request.getIsActive());
        }
        return highlightRepository.save(highlight);
    }

    @Transactional
    public FestivalHighlight toggleActive(Long id) {
        if (highlightRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Map<String, Object> delete(Long id) {
        FestivalHighlight highlight = get(id, true);
        highlightRepository.delete(highlight);
        LOG.info("Deleted festival highlight {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", highlight.getId());
        deleted.put("title", highlight.getTitle());
        return deleted;
    }
}
