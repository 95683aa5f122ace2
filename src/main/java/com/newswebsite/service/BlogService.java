package com.newswebsite.service;

import com.newswebsite.dto.BlogRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.Blog;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.repository.BlogRepository;
import com.newswebsite.repository.UserRepository;
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
public class BlogService {

    private static final Logger LOG = LogManager.getLogger(BlogService.class);

    private static final String RESOURCE = "Blog";
    static final Map<String, String> SORT_FIELDS = Map.of(
            "createdAt", "createdAt",
            "updatedAt", "updatedAt",
            "title", "title",
            "category", "category");

    private final BlogRepository blogRepository;
    private final UserRepository userRepository;
    private final MediaStorage mediaStorage;

    public BlogService(BlogRepository blogRepository, UserRepository userRepository, MediaStorage mediaStorage) {
        this.blogRepository = blogRepository;
        this.userRepository = userRepository;
        this.mediaStorage = mediaStorage;
    }

    public PageResult<Blog> list(PageQuery query, String active, String category, String featured) {
        Specification<Blog> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "title", "content", "category"),
                Specs.equal("isActive", Specs.flag(active)),
                Specs.equal("isFeatured", Specs.flag(featured)),
                Specs.contains("category", category));
        return PageResult.of("blogs",
                blogRepository.findAll(spec, query.toPageable(SORT_FIELDS, "createdAt", Sort.Direction.DESC)), query);
    }

    public PageResult<Blog> listPublic(PageQuery query, String category, String featured) {
        Specification<Blog> spec = Specification.allOf(
                Specs.equal("isActive", Boolean.TRUE),
                Specs.equal("isFeatured", Specs.onlyTrue(featured)),
                Specs.contains("category", category));
        return PageResult.of("blogs",
                blogRepository.findAll(spec, query.toPageable(Map.of(), "createdAt", Sort.Direction.DESC)), query);
    }

    public List<Blog> featured() {
        return blogRepository.findByIsActiveTrueAndIsFeaturedTrueOrderByCreatedAtDesc();
    }

    public Blog get(Long id, boolean includeInactive) {
        return blogRepository.findById(id)
                .filter(blog -> includeInactive || Boolean.TRUE.equals(blog.getIsActive()))
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    /**
     * @param authorId the signed-in editor, recorded as the blog's author
     */
    @Transactional
    public Blog create(BlogRequest request, MultipartFile pdfFile, Long authorId) {
        Inputs.requireAll("Title, content, and category are required fields",
                request.getTitle(), request.getContent(), request.getCategory());

        String pdfUrl = Inputs.hasFile(pdfFile) ? mediaStorage.upload(pdfFile, MediaKind.PDF) : null;

        Blog blog = new Blog();
        blog.setTitle(request.getTitle());
        blog.setContent(request.getContent());
        blog.setCategory(request.getCategory());
        blog.setIsFeatured(request.getIsFeatured() != null ? request.getIsFeatured() : Boolean.FALSE);
        blog.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        blog.setPdfUrl(pdfUrl);
        if (authorId != null) {
            userRepository.findById(authorId).ifPresent(blog::setAuthor);
        }
        Blog saved = blogRepository.save(blog);
        LOG.info("Created blog {}", saved.getId());
        return saved;
    }

    @Transactional
    public Blog update(Long id, BlogRequest request, MultipartFile pdfFile) {
        Blog blog = get(id, true);
        if (request.getTitle() != null) {
            blog.setTitle(Inputs.requireNotBlank(request.getTitle(), "title"));
        }
        if (request.getContent() != null) {
            blog.setContent(Inputs.requireNotBlank(request.getContent(), "content"));
        }
        if (request.getCategory() != null) {
            blog.setCategory(Inputs.requireNotBlank(request.getCategory(), "category"));
        }
        if (request.getIsFeatured() != null) {
            blog.setIsFeatured(request.getIsFeatured());
        }
        if (request.getIsActive() != null) {
            blog.setIsActive(request.getIsActive());
        }
        if (Inputs.hasFile(pdfFile)) {
            blog.setPdfUrl(mediaStorage.upload(pdfFile, MediaKind.PDF));
        }
        return blogRepository.save(blog);
    }

    @Transactional
    public Blog toggleActive(Long id) {
        if (blogRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Blog toggleFeatured(Long id) {
        if (blogRepository.toggleFeatured(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id, true);
    }

    @Transactional
    public Map<String, Object> delete(Long id) {
        Blog blog = get(id, true);
        blogRepository.delete(blog);
        LOG.info("Deleted blog {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", blog.getId());
        deleted.put("title", blog.getTitle());
        return deleted;
    }
}
