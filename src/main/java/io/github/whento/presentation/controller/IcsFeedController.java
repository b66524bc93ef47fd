package io.github.whento.presentation.controller;

import io.github.whento.application.service.IcsFeedService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/v1/ics")
public class IcsFeedController {
    static final MediaType TEXT_CALENDAR = MediaType.parseMediaType("text/calendar; charset=utf-8");
    private static final Pattern HOST = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9.-]*[A-Za-z0-9])?(?::\\d{1,5})?");

    private final IcsFeedService feedService;
    private final String appDomain;

    public IcsFeedController(IcsFeedService feedService,
                             @Value("${whento.app-domain:localhost}") String appDomain) {
        this.feedService = feedService;
        this.appDomain = appDomain;
    }

    @GetMapping("/feed/{token}")
    public ResponseEntity<String> feed(@PathVariable("token") String token,
                                       @RequestHeader(name = "X-Forwarded-Host", required = false) String forwardedHost,
                                       @RequestHeader(name = "X-Real-Host", required = false) String realHost) {
        String icsToken = token.endsWith(".ics") ? token.substring(0, token.length() - 4) : token;
        String body = feedService.feed(icsToken, host(forwardedHost, realHost));
        return ResponseEntity.ok()
                .contentType(TEXT_CALENDAR)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"calendar.ics\"")
                .body(body);
    }

    /** First usable proxy-supplied host, else the configured domain. Values that are not a plain host[:port] are ignored. */
    String host(String forwardedHost, String realHost) {
        if (forwardedHost != null && !forwardedHost.isBlank()) {
            // proxies may append their own host after a comma
            String first = forwardedHost.split(",")[0].trim();
            if (isValidHost(first)) return first;
        }
        if (realHost != null && isValidHost(realHost.trim())) return realHost.trim();
        return appDomain;
    }

    static boolean isValidHost(String value) {
        return value != null && value.length() <= 253 && HOST.matcher(value).matches();
    }
}
