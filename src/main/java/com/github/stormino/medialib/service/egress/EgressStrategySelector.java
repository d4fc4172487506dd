package com.github.stormino.medialib.service.egress;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds the strategy ladder for a job and rewrites it when a client identity is blocked.
 *
 * <p>Per route, when the tenant has a credential and the route allows sending
 * it, the first rung uses the first configured cookie-capable client with the
 * credential; every route then gets a rung with the first credential-free
 * client. Credential-capable routes come first when a credential exists.
 */
@Slf4j
@Component
public class EgressStrategySelector {

    private final List<RouteDescriptor> routes;
    private final List<ClientIdentity> identities;
    private final int maxRungs;
    private final Supplier<String> sessionTags;

    @Autowired
    public EgressStrategySelector(MediaLibraryProperties properties) {
        this(properties, () -> UUID.randomUUID().toString().replace("-", "").substring(0, 10));
    }

    EgressStrategySelector(MediaLibraryProperties properties, Supplier<String> sessionTags) {
        MediaLibraryProperties.Egress egress = properties.getEgress();
        this.routes = egress.getRoutes().isEmpty()
                ? List.of(RouteDescriptor.direct())
                : egress.getRoutes().stream().map(RouteDescriptor::fromConfig).toList();
        this.identities = resolveIdentities(egress.getClientIdentities());
        this.maxRungs = egress.getMaxRungs();
        this.sessionTags = sessionTags;
        log.info("Egress strategy: {} route(s) {}, clients {}, max {} rungs",
                routes.size(), routes, identities, maxRungs);
    }

    /**
     * Produce the ladder for a new job.
     *
     * @param hasCredential Whether a credential (tenant or default) is available
     * @return Bounded ladder, never empty
     */
    public StrategyLadder buildLadder(boolean hasCredential) {
        List<RouteDescriptor> ordered = new ArrayList<>(routes);
        if (hasCredential) {
            // Stable sort: keeps configured order within each group
            ordered.sort(Comparator.comparing(route -> !route.isSupportsCredentials()));
        }

        Optional<ClientIdentity> cookieClient = identities.stream()
                .filter(ClientIdentity::supportsCredentials)
                .findFirst();
        ClientIdentity plainClient = identities.stream()
                .filter(identity -> !identity.supportsCredentials())
                .findFirst()
                .orElse(identities.get(0));

        List<AttemptDescriptor> rungs = new ArrayList<>();
        for (RouteDescriptor route : ordered) {
            if (hasCredential && route.isSupportsCredentials() && cookieClient.isPresent()) {
                rungs.add(new AttemptDescriptor(freshSession(route), cookieClient.get(), true));
            }
            rungs.add(new AttemptDescriptor(freshSession(route), plainClient, false));
        }

        StrategyLadder ladder = new StrategyLadder(rungs, maxRungs);
        log.debug("Built ladder with {} rung(s): {}", ladder.size(), ladder.getRungs());
        return ladder;
    }

    /**
     * React to a rung whose failure points at the client identity: queue the same
     * route under the next client identity not yet on the ladder for that route.
     *
     * @return The inserted rung, if any alternative remained
     */
    public Optional<AttemptDescriptor> retryWithAlternateClient(StrategyLadder ladder, AttemptDescriptor failed,
                                                                boolean hasCredential) {
        RouteDescriptor route = failed.getRoute();
        for (ClientIdentity candidate : identities) {
            if (ladder.containsIdentityOnRoute(route.getName(), candidate)) {
                continue;
            }
            boolean useCredential = hasCredential && route.isSupportsCredentials() && candidate.supportsCredentials();
            AttemptDescriptor alternate = new AttemptDescriptor(route, candidate, useCredential);
            if (ladder.insertNext(alternate)) {
                log.info("Client {} blocked on {}, retrying same route as {}",
                        failed.getClientIdentity().getToolName(), route, candidate.getToolName());
                return Optional.of(alternate);
            }
            return Optional.empty();
        }
        log.debug("No alternate client identity left for route {}", route);
        return Optional.empty();
    }

    private RouteDescriptor freshSession(RouteDescriptor route) {
        return route.isStickySession() ? route.withSessionTag(sessionTags.get()) : route;
    }

    private static List<ClientIdentity> resolveIdentities(List<String> names) {
        List<ClientIdentity> resolved = new ArrayList<>();
        for (String name : names) {
            Optional<ClientIdentity> identity = ClientIdentity.fromName(name);
            if (identity.isEmpty()) {
                log.warn("Ignoring unknown client identity '{}'", name);
            } else if (!resolved.contains(identity.get())) {
                resolved.add(identity.get());
            }
        }
        if (resolved.isEmpty()) {
            resolved.add(ClientIdentity.WEB);
        }
        return List.copyOf(resolved);
    }
}
