package org.springaicommunity.imagededup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builder for creating a {@link DuplicateImageService} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: ImageIO decoding, YIQ pixel matching, anchor grouping
 * DuplicateImageService service = ImageDedupBuilder.create().buildService();
 *
 * // With custom configuration
 * DeduplicationProperties props = new DeduplicationProperties();
 * props.setMaxDifferingPixels(50);
 * props.setGroupingMode(GroupingMode.CONNECTED);
 *
 * DuplicateImageService service = ImageDedupBuilder.create()
 *     .properties(props)
 *     .buildService();
 *
 * DeduplicationResult result = service.findDuplicates(
 *     new DeduplicationRequest(Path.of("photos"), RetentionPolicy.AUTO_KEEP_FIRST));
 *
 * // For testing with a mock repository
 * ImageRepository mockRepository = mock(ImageRepository.class);
 * DuplicateImageService testService = ImageDedupBuilder.create()
 *     .imageRepository(mockRepository)
 *     .buildService();
 * }
 * </pre>
 */
public class ImageDedupBuilder {

	private DeduplicationProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ImageNormalizer normalizer;

	@Nullable
	private SimilarityOracle oracle;

	private boolean hashOnly = false;

	@Nullable
	private ImageRepository imageRepository;

	@Nullable
	private ReportWriter reportWriter;

	private Clock clock = Clock.systemDefaultZone();

	private ImageDedupBuilder() {
		this.properties = new DeduplicationProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ImageDedupBuilder
	 */
	public static ImageDedupBuilder create() {
		return new ImageDedupBuilder();
	}

	/**
	 * Set deduplication properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ImageDedupBuilder properties(@Nullable DeduplicationProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper for report serialization.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ImageDedupBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom ImageNormalizer.
	 * @param normalizer custom normalizer (null to use {@link ImageIoNormalizer})
	 * @return this builder
	 */
	public ImageDedupBuilder normalizer(@Nullable ImageNormalizer normalizer) {
		this.normalizer = normalizer;
		return this;
	}

	/**
	 * Set a custom SimilarityOracle.
	 * @param oracle custom oracle (null to use {@link PixelMatchOracle})
	 * @return this builder
	 */
	public ImageDedupBuilder similarityOracle(@Nullable SimilarityOracle oracle) {
		this.oracle = oracle;
		return this;
	}

	/**
	 * Compare by content hash only; no similarity oracle is consulted.
	 * @return this builder
	 */
	public ImageDedupBuilder hashOnly() {
		this.hashOnly = true;
		return this;
	}

	/**
	 * Set a custom ImageRepository. Useful for testing with mocks.
	 * @param imageRepository custom repository (null to use
	 * {@link FileSystemImageRepository})
	 * @return this builder
	 */
	public ImageDedupBuilder imageRepository(@Nullable ImageRepository imageRepository) {
		this.imageRepository = imageRepository;
		return this;
	}

	/**
	 * Set a custom ReportWriter.
	 * @param reportWriter custom writer (null to use {@link JsonReportWriter})
	 * @return this builder
	 */
	public ImageDedupBuilder reportWriter(@Nullable ReportWriter reportWriter) {
		this.reportWriter = reportWriter;
		return this;
	}

	/**
	 * Set the clock used for report timestamps.
	 * @param clock the clock
	 * @return this builder
	 */
	public ImageDedupBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build a DuplicateComparator.
	 * @return configured DuplicateComparator
	 */
	public DuplicateComparator buildComparator() {
		ImageNormalizer imageNormalizer = this.normalizer != null ? this.normalizer
				: new ImageIoNormalizer(properties);
		SimilarityOracle similarityOracle = null;
		if (!hashOnly) {
			similarityOracle = this.oracle != null ? this.oracle : new PixelMatchOracle();
		}
		return new DuplicateComparator(imageNormalizer, similarityOracle, properties);
	}

	/**
	 * Build a DuplicateGrouper.
	 * @return configured DuplicateGrouper
	 */
	public DuplicateGrouper buildGrouper() {
		return new DuplicateGrouper(repository(), buildComparator(), properties.getGroupingMode());
	}

	/**
	 * Build a DuplicateImageService.
	 * @return configured DuplicateImageService
	 */
	public DuplicateImageService buildService() {
		ImageRepository repository = repository();
		DuplicateGrouper grouper = new DuplicateGrouper(repository, buildComparator(), properties.getGroupingMode());
		ResolutionEngine resolutionEngine = new ResolutionEngine(repository);
		ReportWriter writer = this.reportWriter != null ? this.reportWriter
				: new JsonReportWriter(this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create(),
						Paths.get(properties.getReportDirectory()), clock.getZone());
		return new DuplicateImageService(repository, grouper, resolutionEngine, writer, clock);
	}

	private ImageRepository repository() {
		return this.imageRepository != null ? this.imageRepository : new FileSystemImageRepository(properties);
	}

}
