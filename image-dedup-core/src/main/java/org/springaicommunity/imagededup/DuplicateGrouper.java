package org.springaicommunity.imagededup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitions images into duplicate groups by pairwise comparison.
 *
 * <p>
 * In {@link GroupingMode#ANCHOR} mode images are processed in discovery order: each image
 * not yet claimed by a group anchors a new group and claims every later unclaimed image
 * that {@link DuplicateComparator} matches against it. Two members are therefore only
 * known to match the anchor, not each other. {@link GroupingMode#CONNECTED} compares every
 * pair and returns the connected components of the duplicate graph instead.
 *
 * <p>
 * Each file is read and normalized at most once per run. A file that cannot be read
 * aborts the whole run; a file that cannot be decoded simply matches nothing.
 */
public class DuplicateGrouper {

	private static final Logger logger = LoggerFactory.getLogger(DuplicateGrouper.class);

	private final ImageRepository repository;

	private final DuplicateComparator comparator;

	private final GroupingMode mode;

	public DuplicateGrouper(ImageRepository repository, DuplicateComparator comparator, GroupingMode mode) {
		this.repository = repository;
		this.comparator = comparator;
		this.mode = mode;
	}

	public GroupingMode getMode() {
		return mode;
	}

	/**
	 * Group duplicate images.
	 * @param candidates image paths in discovery order
	 * @return groups of two or more members, ordered by their first member
	 * @throws IOException if any candidate cannot be read
	 */
	public List<DuplicateGroup> groupDuplicates(List<Path> candidates) throws IOException {
		logger.info("Processing {} image files for duplicates ({} grouping)", candidates.size(),
				mode.name().toLowerCase());
		NormalizedImageCache cache = new NormalizedImageCache();
		List<DuplicateGroup> groups = switch (mode) {
			case ANCHOR -> groupByAnchor(candidates, cache);
			case CONNECTED -> groupByConnectedComponents(candidates, cache);
		};
		logger.info("Normalized {} images, {} could not be decoded", cache.loaded, cache.failed);
		return groups;
	}

	private List<DuplicateGroup> groupByAnchor(List<Path> candidates, NormalizedImageCache cache)
			throws IOException {
		boolean[] claimed = new boolean[candidates.size()];
		List<DuplicateGroup> groups = new ArrayList<>();

		for (int i = 0; i < candidates.size(); i++) {
			if (claimed[i]) {
				continue;
			}
			Path anchor = candidates.get(i);
			List<Path> members = new ArrayList<>();
			members.add(anchor);

			for (int j = i + 1; j < candidates.size(); j++) {
				if (claimed[j]) {
					continue;
				}
				Path other = candidates.get(j);
				logger.debug("Comparing {} with {}", anchor, other);
				if (compare(anchor, other, cache)) {
					members.add(other);
					claimed[j] = true;
					// A claimed image is never compared again
					cache.evict(other);
				}
			}
			claimed[i] = true;
			cache.evict(anchor);

			if (members.size() > 1) {
				DuplicateGroup group = new DuplicateGroup(members);
				groups.add(group);
				logger.info("Found duplicate group: {}", group.members());
			}
		}
		return groups;
	}

	private List<DuplicateGroup> groupByConnectedComponents(List<Path> candidates, NormalizedImageCache cache)
			throws IOException {
		int n = candidates.size();
		int[] parent = new int[n];
		for (int i = 0; i < n; i++) {
			parent[i] = i;
		}

		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++) {
				logger.debug("Comparing {} with {}", candidates.get(i), candidates.get(j));
				if (compare(candidates.get(i), candidates.get(j), cache)) {
					union(parent, i, j);
				}
			}
			cache.evict(candidates.get(i));
		}

		// Roots are visited in index order, so components come out ordered by first member
		Map<Integer, List<Path>> components = new LinkedHashMap<>();
		for (int i = 0; i < n; i++) {
			components.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(candidates.get(i));
		}

		List<DuplicateGroup> groups = new ArrayList<>();
		for (List<Path> members : components.values()) {
			if (members.size() > 1) {
				DuplicateGroup group = new DuplicateGroup(members);
				groups.add(group);
				logger.info("Found duplicate group: {}", group.members());
			}
		}
		return groups;
	}

	private static int find(int[] parent, int i) {
		while (parent[i] != i) {
			parent[i] = parent[parent[i]];
			i = parent[i];
		}
		return i;
	}

	// The smaller index always becomes the root.
	private static void union(int[] parent, int a, int b) {
		int rootA = find(parent, a);
		int rootB = find(parent, b);
		if (rootA < rootB) {
			parent[rootB] = rootA;
		}
		else if (rootB < rootA) {
			parent[rootA] = rootB;
		}
	}

	private boolean compare(Path first, Path second, NormalizedImageCache cache) throws IOException {
		Optional<NormalizedImage> image1 = cache.get(first);
		Optional<NormalizedImage> image2 = cache.get(second);
		if (image1.isEmpty() || image2.isEmpty()) {
			return false;
		}
		return comparator.areDuplicates(image1.get(), image2.get());
	}

	/**
	 * Per-run cache of normalized images. An empty value records a decode failure.
	 */
	private final class NormalizedImageCache {

		private final Map<Path, Optional<NormalizedImage>> images = new HashMap<>();

		private int loaded;

		private int failed;

		Optional<NormalizedImage> get(Path path) throws IOException {
			Optional<NormalizedImage> cached = images.get(path);
			if (cached != null) {
				return cached;
			}
			Optional<NormalizedImage> image = load(new Candidate(path, repository.read(path)));
			images.put(path, image);
			return image;
		}

		void evict(Path path) {
			images.remove(path);
		}

		private Optional<NormalizedImage> load(Candidate candidate) {
			try {
				NormalizedImage image = comparator.normalize(candidate.content());
				loaded++;
				return Optional.of(image);
			}
			catch (ImageNormalizationException | RuntimeException e) {
				failed++;
				logger.warn("Cannot decode {}, it will not match any image: {}", candidate.path(), e.getMessage());
				return Optional.empty();
			}
		}

	}

}
