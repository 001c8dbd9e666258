package com.viral.prediction.controller;

import com.viral.prediction.service.PlatformAnalysisService;
import com.viral.prediction.service.platform.InstagramModel;
import com.viral.prediction.service.platform.TikTokModel;
import com.viral.prediction.service.platform.TwitterModel;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/platforms")
@Tag(name = "Platform analysis", description = "Platform-specific content planning")
public class PlatformAnalysisController {

    private static final int DEFAULT_DURATION_DAYS = 7;

    private final PlatformAnalysisService analysisService;

    public PlatformAnalysisController(PlatformAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/twitter/thread-potential")
    @Operation(summary = "Twitter thread potential", description = "Per-tweet scores, coherence and a suggested order")
    public TwitterModel.ThreadAnalysis threadPotential(@RequestBody ThreadRequest request) {
        return analysisService.analyzeTwitterThread(request.tweets());
    }

    @PostMapping("/twitter/schedule")
    @Operation(summary = "Twitter posting schedule")
    public TwitterModel.Schedule twitterSchedule(@RequestBody ScheduleRequest request) {
        return analysisService.scheduleTweets(request.items(), request.timezone(), durationDays(request));
    }

    @PostMapping("/instagram/hashtags")
    @Operation(summary = "Instagram hashtag strategy", description = "Bucket hashtags and estimate their reach")
    public InstagramModel.HashtagStrategy hashtags(@RequestBody HashtagRequest request) {
        return analysisService.analyzeInstagramHashtags(request.hashtags(), request.niche());
    }

    @PostMapping("/tiktok/schedule")
    @Operation(summary = "TikTok posting schedule", description = "Spread videos over the audience's peak hours")
    public TikTokModel.Schedule tiktokSchedule(@RequestBody ScheduleRequest request) {
        return analysisService.scheduleTikToks(request.items(), request.audience(), request.timezone(),
                durationDays(request));
    }

    private static int durationDays(ScheduleRequest request) {
        return request.durationDays() != null ? request.durationDays() : DEFAULT_DURATION_DAYS;
    }

    // ============ REQUEST DTOs ============

    public record ThreadRequest(List<String> tweets) {}

    /**
     * @param items    tweet texts or video captions
     * @param audience TikTok audience id (genZ, genAlpha, millennial, all); ignored for Twitter
     */
    public record ScheduleRequest(List<String> items, String timezone, String audience, Integer durationDays) {}

    public record HashtagRequest(List<String> hashtags, String niche) {}
}
