package com.newswebsite.service;

import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.dto.TransportationRequest;
import com.newswebsite.entity.Transportation;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.repository.TransportationRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class TransportationService {

    private static final Logger LOG = LogManager.getLogger(TransportationService.class);

    private static final String RESOURCE = "Transportation option";
    static final Map<String, String> SORT_FIELDS = Map.of(
            "createdAt", "createdAt",
            "updatedAt", "updatedAt",
            "title", "title",
            "type", "type",
            "order", "displayOrder");

    private final TransportationRepository transportationRepository;

    public TransportationService(TransportationRepository transportationRepository) {
        this.transportationRepository = transportationRepository;
    }

    public PageResult<Transportation> list(PageQuery query, String active) {
        Specification<Transportation> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "title", "type"),
                Specs.equal("isActive", Specs.flag(active)));
        return PageResult.of("transportations",
                transportationRepository.findAll(spec,
                        query.toPageable(SORT_FIELDS, "createdAt", Sort.Direction.DESC)), query);
    }

    public List<Transportation> listPublic() {
        return transportationRepository.findByIsActiveTrueOrderByDisplayOrderAsc();
    }

    public Transportation get(Long id, boolean includeInactive) {
        return transportationRepository.findById(id)
                .filter(option -> includeInactive || Boolean.TRUE.equals(option.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    @Transactional
    public Transportation create(TransportationRequest request) {
        Inputs.requireAll("Title, type, and icon are required fields",
                request.getTitle(), request.getType(), request.getIcon());

        Transportation option = new Transportation();
        option.setType(request.getType());
        option.setTitle(request.getTitle());
        option.setIcon(request.getIcon());
        option.setBgColor(request.getBgColor());
        option.setTextColor(request.getTextColor());
        option.setDetails(request.getDetails());
        option.setTip(request.getTip());
        option.setTipColor(request.getTipColor());
        option.setDisplayOrder(request.getOrder() != null ? request.getOrder() : 0);
        option.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        Transportation saved = transportationRepository.save(option);
        LOG.info("Created transportation option {}", saved.getId());
        return saved;
    }

    @Transactional
    public Transportation update(Long id, TransportationRequest request) {
        Transportation option = get(id, true);
        if (request.getType() != null) {
            option.setType(Inputs.requireNotBlank(request.getType(), "type"));
        }
        if (request.getTitle() != null) {
            option.setTitle(Inputs.requireNotBlank(request.getTitle(), "title"));
        }
        if (request.getIcon() != null) {
            option.setIcon(Inputs.requireNotBlank(request.getIcon(), "icon"));
        }
        if (request.getBgColor() != null) {
            option.setBgColor(request.getBgColor());
        }
        if (request.getTextColor() != null) {
            option.setTextColor(request.getTextColor());
        }
        if (request.getDetails() != null) {
            option.setDetails(request.getDetails());
        }
        if (request.getTip() != null) {
            option.setTip(request.getTip());
        }
        if (request.getTipColor() != null) {
            option.setTipColor(request.getTipColor());
        }
        if (request.getOrder() != null) {
            option.setDisplayOrder(request.getOrder());
        }
        if (request.getIsActive() != null) {
            option.setIsActive(request.getIsActive());
        }
        return transportationRepository.save(option);
    }

    @Transactional
    public Transportation toggleActive(Long id) {
        if (transportationRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Map<String, Object> delete(Long id) {
        Transportation option = get(id, true);
        transportationRepository.delete(option);
        LOG.info("Deleted transportation option {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", option.getId());
        deleted.put("title", option.getTitle());
        return deleted;
    }
}
