package com.viral.prediction.service.explain;

import com.viral.prediction.model.Platform;
import com.viral.prediction.service.explain.ActionableRecommendation.Difficulty;
import com.viral.prediction.service.explain.ActionableRecommendation.Priority;
import com.viral.prediction.service.explain.ActionableRecommendation.Timeframe;
import com.viral.prediction.service.explain.ActionableRecommendation.Type;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed advice tables: one remediation per weak factor and best practices per platform.
 */
final class RemediationCatalog {

    /**
     * Remediation template; the expected impact is |factor impact| times {@code impactScale}.
     */
    record Remediation(ActionableRecommendation template, double impactScale) {

        ActionableRecommendation forImpact(double factorImpact) {
            return template.withExpectedImpact(Math.abs(factorImpact) * impactScale);
        }
    }

    private static final Map<String, Remediation> BY_FACTOR;
    static {
        Map<String, Remediation> m = new LinkedHashMap<>();

        m.put(ExplainableAI.TEXT_QUALITY, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.HIGH, FactorCategory.CONTENT,
                "Improve content readability and information density", 0,
                Difficulty.MEDIUM, Timeframe.IMMEDIATE,
                List.of("Use shorter sentences (15-20 words)",
                        "Include more specific details and facts",
                        "Remove filler words and redundancy"),
                List.of("Instead of: \"This is really amazing and incredible\"",
                        "Try: \"This 5-minute technique increased my productivity by 40%\"")), 15));

        m.put(ExplainableAI.EMOTIONAL_APPEAL, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.HIGH, FactorCategory.CONTENT,
                "Increase emotional engagement in your content", 0,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Share a personal story or experience",
                        "Use emotionally resonant words",
                        "Ask questions that evoke feelings"),
                List.of("I was shocked when I discovered...",
                        "This moment changed everything for me...",
                        "Can you imagine feeling...")), 20));

        m.put(ExplainableAI.CALL_TO_ACTION, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.CONTENT,
                "Add clear calls-to-action to encourage engagement", 0,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Ask viewers to comment their thoughts",
                        "Encourage sharing with friends",
                        "Request likes or saves for later"),
                List.of("What's your experience with this? Comment below!",
                        "Tag someone who needs to see this",
                        "Save this post for later reference")), 12));

        m.put(ExplainableAI.POSTING_TIME, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.TIMING,
                "Schedule the post inside the platform's peak activity window", 0,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Post during the platform's optimal hours",
                        "Prefer the platform's strongest weekdays",
                        "Schedule in your audience's time zone"),
                List.of()), 10));

        m.put(ExplainableAI.TREND_ALIGNMENT, new Remediation(new ActionableRecommendation(
                Type.EXPERIMENT, Priority.MEDIUM, FactorCategory.TIMING,
                "Connect the content to a current trending topic", 0,
                Difficulty.MEDIUM, Timeframe.SHORT_TERM,
                List.of("Reference a topic that is trending on the platform today",
                        "Use the trending hashtag for that topic",
                        "Publish while the trend is still rising"),
                List.of()), 15));

        m.put(ExplainableAI.PLATFORM_OPTIMIZATION, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.PLATFORM,
                "Adapt length and format to the platform", 0,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Keep the text inside the platform's optimal length",
                        "Use the media format the platform favours"),
                List.of()), 12));

        m.put(ExplainableAI.HASHTAG_STRATEGY, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.LOW, FactorCategory.PLATFORM,
                "Replace generic hashtags with trending and niche ones", 0,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Mix one or two trending hashtags with niche ones",
                        "Drop hashtags nobody searches for"),
                List.of()), 8));

        m.put(ExplainableAI.MEDIA_IMPACT, new Remediation(new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.CONTENT,
                "Upgrade the attached media", 0,
                Difficulty.MEDIUM, Timeframe.SHORT_TERM,
                List.of("Use high-resolution images or video",
                        "Prefer short video over static images"),
                List.of()), 10));

        BY_FACTOR = m;
    }

    private static final Map<Platform, ActionableRecommendation> BEST_PRACTICES;
    static {
        Map<Platform, ActionableRecommendation> m = new EnumMap<>(Platform.class);

        m.put(Platform.TWITTER, new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.PLATFORM,
                "Optimize for Twitter best practices", 8,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Keep tweets under 280 characters",
                        "Use 1-2 relevant hashtags",
                        "Include eye-catching visuals",
                        "Engage with replies quickly"),
                List.of("Thread format for longer content", "Quote tweets with commentary")));

        m.put(Platform.INSTAGRAM, new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.PLATFORM,
                "Enhance visual appeal for Instagram", 12,
                Difficulty.MEDIUM, Timeframe.SHORT_TERM,
                List.of("Use high-quality, well-lit images",
                        "Maintain consistent visual style",
                        "Use 5-10 relevant hashtags",
                        "Post during peak hours (11am-1pm, 7-9pm)"),
                List.of("Carousel posts for tutorials", "Stories for behind-the-scenes")));

        m.put(Platform.TIKTOK, new ActionableRecommendation(
                Type.IMPROVE, Priority.HIGH, FactorCategory.PLATFORM,
                "Optimize for TikTok algorithm", 15,
                Difficulty.MEDIUM, Timeframe.IMMEDIATE,
                List.of("Hook viewers in first 3 seconds",
                        "Use trending sounds and effects",
                        "Keep videos 15-30 seconds",
                        "Include text overlays"),
                List.of("Start with \"POV:\" or \"Wait for it...\"", "Use trending audio clips")));

        m.put(Platform.YOUTUBE, new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.PLATFORM,
                "Optimize titles, thumbnails and descriptions for YouTube", 10,
                Difficulty.MEDIUM, Timeframe.SHORT_TERM,
                List.of("Put the main keyword early in the title",
                        "Use a high-contrast thumbnail with a face or bold text",
                        "Write a description of at least 200 characters",
                        "Ask viewers to subscribe near the end"),
                List.of("Shorts for quick tips", "Chapters for long tutorials")));

        m.put(Platform.FACEBOOK, new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.PLATFORM,
                "Encourage conversation on Facebook", 8,
                Difficulty.LOW, Timeframe.IMMEDIATE,
                List.of("Ask a direct question in the post",
                        "Prefer native video over external links",
                        "Reply to early comments"),
                List.of("Polls in groups", "Short native videos with captions")));

        m.put(Platform.LINKEDIN, new ActionableRecommendation(
                Type.IMPROVE, Priority.MEDIUM, FactorCategory.PLATFORM,
                "Lead with professional insight on LinkedIn", 10,
                Difficulty.MEDIUM, Timeframe.SHORT_TERM,
                List.of("Open with a concrete lesson or result",
                        "Use short paragraphs and line breaks",
                        "Post on weekday mornings"),
                List.of("Document posts for frameworks", "Lessons learned from a recent project")));

        BEST_PRACTICES = m;
    }

    private RemediationCatalog() {
    }

    static Optional<Remediation> forFactor(String factor) {
        return Optional.ofNullable(BY_FACTOR.get(factor));
    }

    static Optional<ActionableRecommendation> bestPractice(Platform platform) {
        return Optional.ofNullable(BEST_PRACTICES.get(platform));
    }
}
