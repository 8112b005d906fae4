package villagecompute.wpautomation.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.net.MediaType;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.GeneratedArticleType;
import villagecompute.wpautomation.api.types.PublishResultType;
import villagecompute.wpautomation.api.types.WordPressTermType;
import villagecompute.wpautomation.data.models.ScheduledPost;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.exceptions.ValidationException;
import villagecompute.wpautomation.integration.wordpress.WordPressClient;
import villagecompute.wpautomation.integration.wordpress.WordPressClient.DownloadedImage;

/**
 * Creates a WordPress post from a generated article or a scheduled post.
 *
 * <p>
 * <b>Publish steps:</b>
 * <ol>
 * <li>Match the article's categories against the site's existing categories (never created; default {@code [1]})</li>
 * <li>Find or create each tag; a tag that fails is skipped</li>
 * <li>Download the featured image and upload it to the media library; a failure leaves the post without one</li>
 * <li>Create the post with Yoast SEO meta when there is any</li>
 * </ol>
 */
@ApplicationScoped
public class WordPressPublishService {

    private static final Logger LOG = Logger.getLogger(WordPressPublishService.class);

    public static final long DEFAULT_CATEGORY_ID = 1L;
    static final int MAX_SLUG_LENGTH = 50;
    private static final String DEFAULT_EXTENSION = "jpg";

    @Inject
    WordPressClient client;

    /**
     * @throws ConfigurationException
     *             if the site has no REST credentials
     * @throws RemoteServiceException
     *             if the post could not be created
     */
    public PublishResultType publish(Site site, GeneratedArticleType article, String status) {
        requireCredentials(site);
        if (!"draft".equals(status) && !"publish".equals(status)) {
            throw new ValidationException("Invalid publish status: " + status);
        }

        List<Long> categoryIds = resolveCategories(site, article.categories());
        List<Long> tagIds = resolveTags(site, article.tags());

        Map<String, Object> post = new LinkedHashMap<>();
        post.put("title", article.title());
        post.put("content", article.content());
        post.put("excerpt", article.excerpt() != null ? article.excerpt() : "");
        post.put("status", status);
        post.put("categories", categoryIds);
        post.put("tags", tagIds);

        Map<String, Object> meta = seoMeta(article);
        if (!meta.isEmpty()) {
            post.put("meta", meta);
        }

        if (article.featuredImage() != null && article.featuredImage().url() != null) {
            uploadFeaturedImage(site, article).ifPresent(mediaId -> post.put("featured_media", mediaId));
        }

        PublishResultType result = client.createPost(site, post);
        LOG.infof("Created WordPress post %d on %s (%s): %s", result.postId(), site.url, status, result.link());
        return result;
    }

    /**
     * Publishes a scheduled post as-is: its term and media ids are sent without lookup, and empty optional fields
     * are left out of the request.
     *
     * @throws ConfigurationException
     *             if the site has no REST credentials
     * @throws RemoteServiceException
     *             if the post could not be created
     */
    public PublishResultType publishScheduled(Site site, ScheduledPost scheduled) {
        requireCredentials(site);
        Map<String, Object> post = new LinkedHashMap<>();
        post.put("title", scheduled.title);
        post.put("content", scheduled.content);
        post.put("status", "publish");
        if (scheduled.excerpt != null && !scheduled.excerpt.isBlank()) {
            post.put("excerpt", scheduled.excerpt);
        }
        if (scheduled.categoryIds != null && !scheduled.categoryIds.isEmpty()) {
            post.put("categories", scheduled.categoryIds);
        }
        if (scheduled.tagIds != null && !scheduled.tagIds.isEmpty()) {
            post.put("tags", scheduled.tagIds);
        }
        if (scheduled.featuredMediaId != null) {
            post.put("featured_media", scheduled.featuredMediaId);
        }

        PublishResultType result = client.createPost(site, post);
        LOG.infof("Published scheduled post %s as WordPress post %d on %s", scheduled.id, result.postId(), site.url);
        return result;
    }

    public void updatePost(Site site, long postId, Map<String, Object> fields) {
        requireCredentials(site);
        client.updatePost(site, postId, fields);
    }

    public void deletePost(Site site, long postId, boolean force) {
        requireCredentials(site);
        client.deletePost(site, postId, force);
    }

    List<Long> resolveCategories(Site site, List<String> names) {
        List<WordPressTermType> existing;
        try {
            existing = client.listCategories(site);
        } catch (RemoteServiceException e) {
            LOG.warnf("Failed to fetch categories from %s, using default: %s", site.url, e.getMessage());
            return List.of(DEFAULT_CATEGORY_ID);
        }
        List<Long> ids = matchCategories(existing, names);
        if (ids.isEmpty()) {
            LOG.debugf("No categories matched %s, using default", names);
            return List.of(DEFAULT_CATEGORY_ID);
        }
        return ids;
    }

    /**
     * Exact case-insensitive name match first, then a two-way case-insensitive substring match.
     */
    static List<Long> matchCategories(List<WordPressTermType> existing, List<String> names) {
        Set<Long> ids = new LinkedHashSet<>();
        if (names == null) {
            return List.of();
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            Optional<WordPressTermType> match = existing.stream()
                    .filter(term -> term.name().toLowerCase(Locale.ROOT).equals(wanted)).findFirst();
            if (match.isEmpty()) {
                match = existing.stream().filter(term -> {
                    String candidate = term.name().toLowerCase(Locale.ROOT);
                    return !candidate.isEmpty() && (candidate.contains(wanted) || wanted.contains(candidate));
                }).findFirst();
            }
            match.ifPresent(term -> ids.add(term.id()));
        }
        return new ArrayList<>(ids);
    }

    List<Long> resolveTags(Site site, List<String> names) {
        List<Long> ids = new ArrayList<>();
        if (names == null) {
            return ids;
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            try {
                Optional<WordPressTermType> found = client.findTag(site, name);
                long id = found.isPresent() ? found.get().id() : client.createTag(site, name).id();
                if (!ids.contains(id)) {
                    ids.add(id);
                }
            } catch (RemoteServiceException e) {
                LOG.warnf("Failed to get or create tag \"%s\" on %s: %s", name, site.url, e.getMessage());
            }
        }
        return ids;
    }

    private Optional<Long> uploadFeaturedImage(Site site, GeneratedArticleType article) {
        try {
            DownloadedImage image = client.downloadImage(article.featuredImage().url());
            long mediaId = client.uploadMedia(site, image,
                    slug(article.title()) + "." + fileExtension(image.contentType()));
            LOG.debugf("Uploaded featured image %s as media %d", article.featuredImage().url(), mediaId);
            return Optional.of(mediaId);
        } catch (RemoteServiceException | IllegalArgumentException e) {
            LOG.warnf("Failed to upload featured image for \"%s\", continuing without: %s", article.title(),
                    e.getMessage());
            return Optional.empty();
        }
    }

    private static Map<String, Object> seoMeta(GeneratedArticleType article) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (article.seoDescription() != null && !article.seoDescription().isBlank()) {
            meta.put("_yoast_wpseo_metadesc", article.seoDescription());
        }
        if (article.seoKeywords() != null && !article.seoKeywords().isEmpty()) {
            meta.put("_yoast_wpseo_focuskw", String.join(", ", article.seoKeywords()));
        }
        return meta;
    }

    /**
     * File extension for an image content type: {@code image/jpeg} is {@code jpg}, a structured suffix such as
     * {@code +xml} is dropped, and anything unparseable is {@code jpg}.
     */
    static String fileExtension(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        String subtype;
        try {
            subtype = MediaType.parse(contentType.trim()).subtype();
        } catch (IllegalArgumentException e) {
            LOG.debugf("Unparseable image content type \"%s\": %s", contentType, e.getMessage());
            return DEFAULT_EXTENSION;
        }
        int suffix = subtype.indexOf('+');
        if (suffix >= 0) {
            subtype = subtype.substring(0, suffix);
        }
        subtype = subtype.toLowerCase(Locale.ROOT);
        if (subtype.startsWith("x-")) {
            subtype = subtype.substring(2);
        }
        return switch (subtype) {
            case "jpeg", "pjpeg", "jpg" -> "jpg";
            case "", "*", "octet-stream" -> DEFAULT_EXTENSION;
            default -> subtype.replaceAll("[^a-z0-9]", "");
        };
    }

    /**
     * Lowercase file-name slug: non-alphanumerics collapsed to {@code -}, at most {@value #MAX_SLUG_LENGTH} chars.
     */
    static String slug(String title) {
        String slug = (title == null ? "" : title).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "image" : slug;
    }

    private static void requireCredentials(Site site) {
        if (site == null || !site.hasCredentials()) {
            throw new ConfigurationException(
                    "WordPress credentials are not configured for site " + (site != null ? site.id : null));
        }
    }
}
