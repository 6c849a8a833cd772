package com.bikeway.route.service;

import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Route handles: a random UUID followed by eight hex characters of an MD5 over the path content.
 */
@Component
public class RouteIdGenerator {

    private static final int SUFFIX_LENGTH = 8;

    public String generate(GraphHopperPath path) {
        return UUID.randomUUID() + "-" + contentSuffix(path);
    }

    String contentSuffix(GraphHopperPath path) {
        StringBuilder content = new StringBuilder();
        for (double[] point : path.coordinates()) {
            content.append(point[0]).append(',').append(point[1]).append(';');
        }
        content.append(String.format(Locale.US, "%.3f|%d|%s", path.getDistance(), path.getTime(), path.getProfile()));
        return DigestUtils.md5DigestAsHex(content.toString().getBytes(StandardCharsets.UTF_8))
                .substring(0, SUFFIX_LENGTH);
    }
}
