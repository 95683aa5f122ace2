package com.newswebsite.service;

import com.newswebsite.dto.NewsRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.News;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.repository.NewsRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class NewsService {

    private static final Logger LOG = LogManager.getLogger(NewsService.class);

    private static final String RESOURCE = "News";
    static final Map<String, String> SORT_FIELDS = Map.of(
            "createdAt", "createdAt",
            "updatedAt", "updatedAt",
            "title", "title",
            "category", "category");

    private final NewsRepository newsRepository;
    private final MediaStorage mediaStorage;

    public NewsService(NewsRepository newsRepository, MediaStorage mediaStorage) {
        this.newsRepository = newsRepository;
        this.mediaStorage = mediaStorage;
    }

    public PageResult<News> list(PageQuery query, String active, String category, String trending) {
        Specification<News> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "title", "content", "category"),
                Specs.equal("isActive", Specs.flag(active)),
                Specs.equal("isTrending", Specs.flag(trending)),
                Specs.contains("category", category));
        return PageResult.of("news",
                newsRepository.findAll(spec, query.toPageable(SORT_FIELDS, "createdAt", Sort.Direction.DESC)), query);
    }

    public PageResult<News> listPublic(PageQuery query, String category, String trending) {
        Specification<News> spec = Specification.allOf(
                Specs.equal("isActive", Boolean.TRUE),
                Specs.equal("isTrending", Specs.onlyTrue(trending)),
                Specs.contains("category", category));
        return PageResult.of("news",
                newsRepository.findAll(spec, query.toPageable(Map.of(), "createdAt", Sort.Direction.DESC)), query);
    }

    public List<News> trending() {
        return newsRepository.findByIsActiveTrueAndIsTrendingTrueOrderByCreatedAtDesc();
    }

    /**
     * @param includeInactive false for anonymous callers, who never see deactivated news
     */
    public News get(Long id, boolean includeInactive) {
        return newsRepository.findById(id)
                .filter(news -> includeInactive || Boolean.TRUE.equals(news.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    @Transactional
    public News create(NewsRequest request, MultipartFile imageFile) {
        Inputs.requireAll("Title, content, and category are required fields",
                request.getTitle(), request.getContent(), request.getCategory());

        String imageUrl = Inputs.hasFile(imageFile) ? mediaStorage.upload(imageFile, MediaKind.IMAGE) : null;

        News news = new News();
        news.setTitle(request.getTitle());
        news.setContent(request.getContent());
        news.setCategory(request.getCategory());
        news.setIsTrending(request.getIsTrending() != null ? request.getIsTrending() : Boolean.FALSE);
        news.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        news.setImageUrl(imageUrl);
        News saved = newsRepository.save(news);
        LOG.info("Created news {}", saved.getId());
        return saved;
    }

    @Transactional
    public News update(Long id, NewsRequest request, MultipartFile imageFile) {
        News news = get(id, true);
        if (request.getTitle() != null) {
            news.setTitle(Inputs.requireNotBlank(request.getTitle(), "title"));
        }
        if (request.getContent() != null) {
            news.setContent(Inputs.requireNotBlank(request.getContent(), "content"));
        }
        if (request.getCategory() != null) {
            news.setCategory(Inputs.requireNotBlank(request.getCategory(), "category"));
        }
        if (request.getIsTrending() != null) {
            news.setIsTrending(request.getIsTrending());
        }
        if (request.getIsActive() != null) {
            news.setIsActive(request.getIsActive());
        }
        if (Inputs.hasFile(imageFile)) {
            news.setImageUrl(mediaStorage.upload(imageFile, MediaKind.IMAGE));
        }
        return newsRepository.save(news);
    }

    @Transactional
    public News toggleActive(Long id) {
        if (newsRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public News toggleTrending(Long id) {
        if (newsRepository.toggleTrending(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Map<String, Object> delete(Long id) {
        News news = get(id, true);
        newsRepository.delete(news);
        LOG.info("Deleted news {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", news.getId());
        deleted.put("title", news.getTitle());
        return deleted;
    }
}
