package org.operaton.nostrpub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.model.activitypub.Actor;
import org.operaton.nostrpub.model.bridge.Degradation;
import org.operaton.nostrpub.model.bridge.EventRef;
import org.operaton.nostrpub.model.bridge.InboundContext;
import org.operaton.nostrpub.model.bridge.MentionTarget;
import org.operaton.nostrpub.model.bridge.ObjectRef;
import org.operaton.nostrpub.model.bridge.OutboundContext;
import org.operaton.nostrpub.model.bridge.TranslationResult;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.EventKind;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.model.nostr.ProfileMetadata;
import org.operaton.nostrpub.security.SchnorrSigner;
import org.operaton.nostrpub.util.ActivityJson;
import org.operaton.nostrpub.util.Bech32;
import org.operaton.nostrpub.util.TextTransform;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.operaton.nostrpub.util.ActivityJson.idOf;
import static org.operaton.nostrpub.util.ActivityJson.objects;
import static org.operaton.nostrpub.util.ActivityJson.string;

/**
 * Translates between Nostr events and ActivityPub activities.
 *
 * <p>Every method is a pure function of its arguments: identities, reply parents and mention targets
 * are resolved by the caller beforehand. Fields without counterpart are dropped; whatever meaning is lost
 * on the way is reported as {@link Degradation}.</p>
 *
 * <p>Inbound methods return unsigned drafts; the caller signs them with the actor's derived key.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentTranslator {

    private static final String ACTIVITY_STREAMS = "https://www.w3.org/ns/activitystreams";
    private static final String NOSTR_PROTOCOL = "https://github.com/nostr-protocol/nostr";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private static final Pattern NOSTR_KEY = Pattern.compile("(?:nostr:)?((?:npub1|nprofile1)[0-9a-z]{50,})");
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?)]+$");
    private static final Pattern HASHTAG_LINK = Pattern.compile("\\[(#[^\\]]+)\\]\\([^)]*\\)");
    private static final String HANDLE = "@[\\w.-]+(?:@[\\w.-]+)?";
    private static final String HANDLE_TEXT = "(?:" + HANDLE + "|\\[" + HANDLE + "\\]\\([^)]*\\))";
    private static final Pattern HEAD_MENTIONS = Pattern.compile(
        "^\\s*(?:" + HANDLE_TEXT + " )*" + HANDLE_TEXT + "\\s*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern MENTION_LINK = Pattern.compile(
        "\\[@(?<username>[\\w.-]+)(?:@(?<domain>[\\w.-]+))?\\]\\((?<url>[^)]+)\\)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Set<String> REPLY_MARKERS = Set.of("root", "reply", "mention");

    private static final Map<String, String> MEDIA_EXTENSIONS = Map.ofEntries(
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("png", "image/png"),
        Map.entry("gif", "image/gif"),
        Map.entry("webp", "image/webp"),
        Map.entry("avif", "image/avif"),
        Map.entry("mp4", "video/mp4"),
        Map.entry("webm", "video/webm"),
        Map.entry("mov", "video/quicktime"),
        Map.entry("mp3", "audio/mpeg"),
        Map.entry("ogg", "audio/ogg"),
        Map.entry("wav", "audio/wav"),
        Map.entry("m4a", "audio/mp4")
    );

    private final BridgeUris uris;
    private final TextTransform textTransform;
    private final ObjectMapper objectMapper;

    // ==================== NIP-10 threading ====================

    /**
     * Event a note replies to: the {@code reply} marker, else the {@code root} marker,
     * else the last unmarked {@code e} tag.
     */
    public static Optional<String> replyTargetOf(NostrEvent event) {
        List<List<String>> eTags = event.tags("e").stream()
            .filter(tag -> tag.size() > 1)
            .collect(Collectors.toList());
        List<List<String>> marked = eTags.stream()
            .filter(tag -> tag.size() > 3 && REPLY_MARKERS.contains(tag.get(3)))
            .collect(Collectors.toList());
        if (!marked.isEmpty()) {
            Optional<String> reply = markedEvent(marked, "reply");
            return reply.isPresent() ? reply : markedEvent(marked, "root");
        }
        return eTags.isEmpty() ? Optional.empty() : Optional.of(eTags.get(eTags.size() - 1).get(1));
    }

    /**
     * Thread root of a note: the {@code root} marker, else the first unmarked {@code e} tag.
     */
    public static Optional<String> rootOf(NostrEvent event) {
        List<List<String>> eTags = event.tags("e").stream()
            .filter(tag -> tag.size() > 1)
            .collect(Collectors.toList());
        boolean anyMarked = eTags.stream().anyMatch(tag -> tag.size() > 3 && REPLY_MARKERS.contains(tag.get(3)));
        if (anyMarked) {
            return markedEvent(eTags, "root");
        }
        return eTags.isEmpty() ? Optional.empty() : Optional.of(eTags.get(0).get(1));
    }

    /**
     * Event a reaction (last {@code e} tag) or repost (first {@code e} tag) points at.
     */
    public static Optional<String> targetOf(NostrEvent event) {
        List<String> ids = event.tagValues("e");
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(event.getKind() == EventKind.REACTION.getCode() ? ids.get(ids.size() - 1) : ids.get(0));
    }

    /**
     * Keys a note refers to, through {@code p} tags or inline {@code nostr:} references.
     */
    public static Set<String> mentionedKeysOf(NostrEvent event) {
        Set<String> keys = new LinkedHashSet<>(event.tagValues("p"));
        Matcher matcher = NOSTR_KEY.matcher(event.getContent() == null ? "" : event.getContent());
        while (matcher.find()) {
            try {
                keys.add(NativeIdentity.fromBech32(matcher.group(1)).hex());
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed key reference {}", matcher.group(1));
            }
        }
        return keys;
    }

    // ==================== Native -> federated ====================

    /**
     * Kind 1 note to {@code Create{Note}}. A reply whose parent is unknown becomes a top-level post.
     */
    public TranslationResult<Map<String, Object>> toCreate(NostrEvent event, OutboundContext ctx) {
        List<Degradation> degradations = new ArrayList<>();
        Map<String, Object> note = toNote(event, ctx, degradations);

        Map<String, Object> create = new LinkedHashMap<>();
        create.put("@context", ACTIVITY_STREAMS);
        create.put("id", uris.activityUri(event.getId()));
        create.put("type", "Create");
        create.put("actor", ctx.getActorUri());
        create.put("published", note.get("published"));
        create.put("to", note.get("to"));
        create.put("cc", note.get("cc"));
        create.put("object", note);
        return TranslationResult.of(create, degradations);
    }

    /**
     * Kind 1 note to a {@code Note} object.
     */
    public Map<String, Object> toNote(NostrEvent event, OutboundContext ctx, List<Degradation> degradations) {
        String noteUri = uris.noteUri(event.getId());
        List<Object> tags = new ArrayList<>();
        List<String> cc = new ArrayList<>();
        cc.add(ctx.getFollowersUri());

        MediaSplit media = extractMedia(event, degradations);

        // Inline mentions become mention links; the rest of the p tags only address the note
        Set<String> mentioned = new LinkedHashSet<>();
        String html = textTransform.markdownToHtml(media.text);
        Matcher matcher = NOSTR_KEY.matcher(html);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = matcher.group();
            try {
                NativeIdentity identity = NativeIdentity.fromBech32(matcher.group(1));
                MentionTarget target = ctx.getMentions().get(identity.hex());
                if (target != null) {
                    replacement = mentionHtml(target);
                    mentioned.add(identity.hex());
                } else {
                    degradations.add(Degradation.of(Degradation.Reason.UNRESOLVED_MENTION, identity.npub()));
                }
            } catch (IllegalArgumentException e) {
                log.debug("Keeping malformed key reference {} as text", matcher.group(1));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        html = sb.toString();

        for (String key : event.tagValues("p")) {
            if (ctx.getMentions().containsKey(key)) {
                mentioned.add(key);
            }
        }
        for (String key : mentioned) {
            MentionTarget target = ctx.getMentions().get(key);
            Map<String, Object> mention = new LinkedHashMap<>();
            mention.put("type", "Mention");
            mention.put("href", target.getActorUri());
            mention.put("name", target.getHandle());
            tags.add(mention);
            if (!cc.contains(target.getActorUri())) {
                cc.add(target.getActorUri());
            }
        }

        String inReplyTo = null;
        Optional<String> replyTarget = replyTargetOf(event);
        if (replyTarget.isPresent()) {
            ObjectRef parent = ctx.getObjects().get(replyTarget.get());
            if (parent != null) {
                inReplyTo = parent.getObjectId();
                if (parent.getAuthorUri() != null && !cc.contains(parent.getAuthorUri())) {
                    cc.add(parent.getAuthorUri());
                }
            } else {
                degradations.add(Degradation.of(Degradation.Reason.MISSING_PARENT, replyTarget.get()));
            }
        }

        for (String hashtag : new LinkedHashSet<>(event.tagValues("t"))) {
            String name = hashtag.startsWith("#") ? hashtag.substring(1) : hashtag;
            if (name.isBlank()) {
                continue;
            }
            Map<String, Object> tag = new LinkedHashMap<>();
            tag.put("type", "Hashtag");
            tag.put("href", uris.hashtagUri(name));
            tag.put("name", "#" + name);
            tags.add(tag);
        }
        tags.addAll(emojiTags(event));

        Map<String, Object> note = new LinkedHashMap<>();
        note.put("id", noteUri);
        note.put("type", "Note");
        note.put("attributedTo", ctx.getActorUri());
        note.put("content", html);
        note.put("published", Instant.ofEpochSecond(event.getCreatedAt()).toString());
        note.put("url", noteUri);
        note.put("to", List.of(ActivityJson.PUBLIC));
        note.put("cc", cc);
        if (inReplyTo != null) {
            note.put("inReplyTo", inReplyTo);
        }
        event.firstTagValue("q")
            .map(quoted -> ctx.getObjects().get(quoted))
            .ifPresent(quoted -> note.put("quoteUrl", quoted.getObjectId()));
        if (!event.tags("content-warning").isEmpty()) {
            note.put("sensitive", true);
            event.firstTagValue("content-warning")
                .filter(reason -> !reason.isBlank())
                .ifPresent(reason -> note.put("summary", reason));
        }
        if (!tags.isEmpty()) {
            note.put("tag", tags);
        }
        if (!media.attachments.isEmpty()) {
            note.put("attachment", media.attachments);
        }
        note.put("proxyOf", List.of(proxyOf(Bech32.encode("note", Bech32.fromHex(event.getId())))));
        return note;
    }

    /**
     * Kind 7 reaction to {@code Like} ({@code +} or empty) or {@code EmojiReact} (anything else).
     */
    public TranslationResult<Map<String, Object>> toReaction(NostrEvent event, OutboundContext ctx) {
        Optional<String> targetId = targetOf(event);
        if (targetId.isEmpty()) {
            return TranslationResult.skipped(Degradation.of(Degradation.Reason.MISSING_TARGET, "reaction without e tag"));
        }
        ObjectRef target = ctx.getObjects().get(targetId.get());
        if (target == null) {
            return TranslationResult.skipped(Degradation.of(Degradation.Reason.MISSING_TARGET, targetId.get()));
        }

        String content = event.getContent() == null ? "" : event.getContent().trim();
        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("@context", ACTIVITY_STREAMS);
        activity.put("id", uris.activityUri(event.getId()));
        activity.put("actor", ctx.getActorUri());
        activity.put("published", Instant.ofEpochSecond(event.getCreatedAt()).toString());
        activity.put("object", target.getObjectId());
        if (target.getAuthorUri() != null) {
            activity.put("to", List.of(target.getAuthorUri()));
        }
        if (content.isEmpty() || "+".equals(content)) {
            activity.put("type", "Like");
        } else {
            activity.put("type", "EmojiReact");
            activity.put("content", content);
            List<Map<String, Object>> emoji = emojiTags(event).stream()
                .filter(tag -> content.equals(tag.get("name")))
                .collect(Collectors.toList());
            if (!emoji.isEmpty()) {
                activity.put("tag", emoji);
            }
        }
        return TranslationResult.of(activity);
    }

    /**
     * Kind 6 repost to {@code Announce}.
     */
    public TranslationResult<Map<String, Object>> toAnnounce(NostrEvent event, OutboundContext ctx) {
        Optional<String> targetId = targetOf(event);
        if (targetId.isEmpty()) {
            return TranslationResult.skipped(Degradation.of(Degradation.Reason.MISSING_TARGET, "repost without e tag"));
        }
        ObjectRef target = ctx.getObjects().get(targetId.get());
        if (target == null) {
            return TranslationResult.skipped(Degradation.of(Degradation.Reason.MISSING_TARGET, targetId.get()));
        }
        List<String> cc = new ArrayList<>();
        cc.add(ctx.getFollowersUri());
        if (target.getAuthorUri() != null) {
            cc.add(target.getAuthorUri());
        }

        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("@context", ACTIVITY_STREAMS);
        activity.put("id", uris.activityUri(event.getId()));
        activity.put("type", "Announce");
        activity.put("actor", ctx.getActorUri());
        activity.put("published", Instant.ofEpochSecond(event.getCreatedAt()).toString());
        activity.put("to", List.of(ActivityJson.PUBLIC));
        activity.put("cc", cc);
        activity.put("object", target.getObjectId());
        return TranslationResult.of(activity);
    }

    /**
     * Follow list changes to one {@code Follow} per added and one {@code Undo{Follow}} per removed actor.
     */
    public List<Map<String, Object>> toFollowChanges(String actorUri, Collection<String> addedTargets,
                                                     Collection<String> removedTargets, long createdAt) {
        List<Map<String, Object>> activities = new ArrayList<>();
        for (String target : addedTargets) {
            Map<String, Object> follow = toFollow(actorUri, target);
            follow.put("@context", ACTIVITY_STREAMS);
            activities.add(follow);
        }
        for (String target : removedTargets) {
            Map<String, Object> undo = new LinkedHashMap<>();
            undo.put("@context", ACTIVITY_STREAMS);
            undo.put("id", followId(actorUri, target) + "/undo/" + createdAt);
            undo.put("type", "Undo");
            undo.put("actor", actorUri);
            undo.put("object", toFollow(actorUri, target));
            activities.add(undo);
        }
        return activities;
    }

    /**
     * {@code Follow} with a deterministic id, so the matching Undo can reference it.
     */
    public Map<String, Object> toFollow(String actorUri, String targetUri) {
        Map<String, Object> follow = new LinkedHashMap<>();
        follow.put("id", followId(actorUri, targetUri));
        follow.put("type", "Follow");
        follow.put("actor", actorUri);
        follow.put("object", targetUri);
        return follow;
    }

    /**
     * {@code Accept} of a fediverse actor's {@code Follow}, sent by the followed virtual actor.
     */
    public Map<String, Object> toAccept(String actorUri, Map<String, Object> follow) {
        Map<String, Object> accepted = new LinkedHashMap<>(follow);
        accepted.remove("@context");
        String followRef = string(follow, "id") != null ? string(follow, "id") : idOf(follow.get("actor"));

        Map<String, Object> accept = new LinkedHashMap<>();
        accept.put("@context", ACTIVITY_STREAMS);
        accept.put("id", followId(actorUri, String.valueOf(followRef)).replace("/follows/", "/accepts/"));
        accept.put("type", "Accept");
        accept.put("actor", actorUri);
        accept.put("object", accepted);
        return accept;
    }

    /**
     * Kind 0 metadata, already applied to the virtual actor, to {@code Update{Person}}.
     */
    public Map<String, Object> toUpdate(VirtualActor actor, long createdAt) {
        Map<String, Object> person = objectMapper.convertValue(
            Actor.fromVirtualActor(actor, uris.sharedInbox(), actor.getActorUri()), MAP_TYPE);
        person.remove("@context");

        Map<String, Object> update = new LinkedHashMap<>();
        update.put("@context", List.of(ACTIVITY_STREAMS, "https://w3id.org/security/v1"));
        update.put("id", actor.getActorUri() + "#updates/" + createdAt);
        update.put("type", "Update");
        update.put("actor", actor.getActorUri());
        update.put("published", Instant.ofEpochSecond(createdAt).toString());
        update.put("to", List.of(ActivityJson.PUBLIC));
        update.put("cc", List.of(actor.getFollowersUri()));
        update.put("object", person);
        return update;
    }

    /**
     * Kind 5 deletion to {@code Delete{Tombstone}} for notes and {@code Undo} for likes and announces.
     * Only objects of the deleting author are considered.
     */
    public TranslationResult<List<Map<String, Object>>> toDeletes(NostrEvent deletion, OutboundContext ctx) {
        List<Degradation> degradations = new ArrayList<>();
        List<Map<String, Object>> activities = new ArrayList<>();
        for (String eventId : new LinkedHashSet<>(deletion.tagValues("e"))) {
            ObjectRef target = ctx.getObjects().get(eventId);
            if (target == null || !ctx.getActorUri().equals(target.getAuthorUri())) {
                degradations.add(Degradation.of(Degradation.Reason.MISSING_TARGET, eventId));
                continue;
            }
            Map<String, Object> activity = new LinkedHashMap<>();
            activity.put("@context", ACTIVITY_STREAMS);
            activity.put("id", uris.activityUri(deletion.getId()) + "/" + eventId);
            activity.put("actor", ctx.getActorUri());
            activity.put("to", List.of(ActivityJson.PUBLIC));
            activity.put("cc", List.of(ctx.getFollowersUri()));
            if (target.getKind() == EventKind.NOTE.getCode()) {
                Map<String, Object> tombstone = new LinkedHashMap<>();
                tombstone.put("id", target.getObjectId());
                tombstone.put("type", "Tombstone");
                activity.put("type", "Delete");
                activity.put("object", tombstone);
            } else {
                Map<String, Object> undone = new LinkedHashMap<>();
                undone.put("id", target.getObjectId());
                undone.put("type", target.getKind() == EventKind.REPOST.getCode() ? "Announce" : "Like");
                undone.put("actor", ctx.getActorUri());
                activity.put("type", "Undo");
                activity.put("object", undone);
            }
            activities.add(activity);
        }
        if (activities.isEmpty()) {
            return TranslationResult.of(null, degradations);
        }
        return TranslationResult.of(activities, degradations);
    }

    // ==================== Federated -> native ====================

    /**
     * {@code Note} to an unsigned kind 1 draft. A reply whose parent is absent from the context
     * becomes a top-level post.
     */
    public TranslationResult<NostrEvent> fromNote(Map<String, Object> note, InboundContext ctx) {
        List<Degradation> degradations = new ArrayList<>();
        List<List<String>> tags = new ArrayList<>();
        String noteId = string(note, "id");

        String summary = string(note, "summary");
        if (summary != null && !summary.isBlank()) {
            tags.add(List.of("content-warning", textTransform.htmlToMarkdown(summary)));
        } else if (Boolean.TRUE.equals(note.get("sensitive"))) {
            tags.add(List.of("content-warning"));
        }

        boolean isReply = idOf(note.get("inReplyTo")) != null;
        EventRef parent = ctx.getParent();
        if (isReply && parent == null) {
            degradations.add(Degradation.of(Degradation.Reason.MISSING_PARENT, idOf(note.get("inReplyTo"))));
        }
        if (parent != null) {
            for (String key : parent.getMentionedPubkeys()) {
                tags.add(List.of("p", key));
            }
            tags.add(List.of("p", parent.getAuthorPubkey()));
            if (parent.getRootEventId() != null) {
                tags.add(List.of("e", parent.getRootEventId(), "", "root"));
                tags.add(List.of("e", parent.getEventId(), "", "reply"));
            } else {
                tags.add(List.of("e", parent.getEventId(), "", "root"));
            }
        }

        for (Map<String, Object> tag : objects(note, "tag")) {
            String type = string(tag, "type");
            if (type == null) {
                continue;
            }
            switch (type) {
                case "Mention" -> {
                    String href = string(tag, "href");
                    String key = href == null ? null : ctx.getMentionKeys().get(href);
                    if (key != null) {
                        tags.add(List.of("p", key));
                    } else {
                        degradations.add(Degradation.of(Degradation.Reason.UNRESOLVED_MENTION, String.valueOf(href)));
                    }
                }
                case "Emoji" -> {
                    String name = string(tag, "name");
                    String url = idOf(ActivityJson.asMap(tag.get("icon")) != null
                        ? ActivityJson.asMap(tag.get("icon")).get("url") : null);
                    if (name != null && url != null) {
                        tags.add(List.of("emoji", trimColons(name), url));
                    }
                }
                case "Hashtag" -> {
                    String name = string(tag, "name");
                    if (name != null) {
                        String stripped = name.startsWith("#") ? name.substring(1) : name;
                        if (!stripped.isBlank()) {
                            tags.add(List.of("t", stripped.toLowerCase(Locale.ROOT)));
                        }
                    }
                }
                default -> log.trace("Ignoring tag type {}", type);
            }
        }

        String content = noteContent(note);
        if (isReply) {
            Matcher head = HEAD_MENTIONS.matcher(content);
            if (head.find()) {
                content = content.substring(head.end());
            }
        }
        content = replaceMentionLinks(content, ctx);

        List<Map<String, Object>> attachments = objects(note, "attachment");
        if (!attachments.isEmpty()) {
            StringBuilder withMedia = new StringBuilder(content);
            for (Map<String, Object> attachment : attachments) {
                String url = attachmentUrl(attachment);
                if (url == null) {
                    continue;
                }
                if (withMedia.length() > 0 && withMedia.charAt(withMedia.length() - 1) != '\n') {
                    withMedia.append('\n');
                }
                withMedia.append(url);
                List<String> imeta = new ArrayList<>();
                imeta.add("imeta");
                imeta.add("url " + url);
                String mediaType = string(attachment, "mediaType");
                if (mediaType != null) {
                    imeta.add("m " + mediaType);
                }
                String alt = string(attachment, "name");
                if (alt != null && !alt.isBlank()) {
                    imeta.add("alt " + alt);
                }
                tags.add(imeta);
            }
            content = withMedia.toString();
        }

        EventRef quote = ctx.getQuote();
        if (quote != null) {
            tags.add(List.of("q", quote.getEventId()));
            tags.add(List.of("p", quote.getAuthorPubkey()));
            String separator = content.isEmpty() || content.endsWith("\n") ? "" : "\n";
            content = content + separator + "nostr:" + Bech32.encode("note", Bech32.fromHex(quote.getEventId()));
        }

        String url = idOf(note.get("url"));
        if (url != null && !url.equals(noteId)) {
            tags.add(List.of("proxy", url, "web"));
        }

        NostrEvent draft = NostrEvent.builder()
            .kind(EventKind.NOTE.getCode())
            .createdAt(timestamp(string(note, "published"), ctx.getReceivedAt()))
            .content(content)
            .tags(eventTags(noteId, tags))
            .build();
        return TranslationResult.of(draft, degradations);
    }

    /**
     * {@code Like} to a {@code +} reaction, {@code EmojiReact} to a reaction carrying the emoji.
     */
    public NostrEvent fromReaction(Map<String, Object> activity, EventRef target, long receivedAt) {
        List<List<String>> tags = new ArrayList<>();
        tags.add(List.of("e", target.getEventId()));
        tags.add(List.of("p", target.getAuthorPubkey()));
        tags.add(List.of("k", String.valueOf(target.getKind())));

        String content = "+";
        if ("EmojiReact".equals(string(activity, "type"))) {
            String emoji = string(activity, "content");
            if (emoji != null && !emoji.isBlank()) {
                content = emoji.trim();
                for (Map<String, Object> tag : objects(activity, "tag")) {
                    Map<String, Object> icon = ActivityJson.asMap(tag.get("icon"));
                    String iconUrl = icon == null ? null : idOf(icon.get("url"));
                    if ("Emoji".equals(string(tag, "type")) && content.equals(string(tag, "name")) && iconUrl != null) {
                        tags.add(List.of("emoji", trimColons(content), iconUrl));
                    }
                }
            }
        }
        return NostrEvent.builder()
            .kind(EventKind.REACTION.getCode())
            .createdAt(timestamp(string(activity, "published"), receivedAt))
            .content(content)
            .tags(eventTags(string(activity, "id"), tags))
            .build();
    }

    /**
     * {@code Announce} to a kind 6 repost.
     */
    public NostrEvent fromAnnounce(Map<String, Object> activity, EventRef target, long receivedAt) {
        List<List<String>> tags = new ArrayList<>();
        tags.add(List.of("e", target.getEventId()));
        tags.add(List.of("p", target.getAuthorPubkey()));
        return NostrEvent.builder()
            .kind(EventKind.REPOST.getCode())
            .createdAt(timestamp(string(activity, "published"), receivedAt))
            .content("")
            .tags(eventTags(string(activity, "id"), tags))
            .build();
    }

    /**
     * Deletion request for events previously bridged from the fediverse.
     */
    public NostrEvent deletion(String activityId, Collection<String> eventIds, long createdAt) {
        List<List<String>> tags = new ArrayList<>();
        for (String eventId : eventIds) {
            tags.add(List.of("e", eventId));
        }
        return NostrEvent.builder()
            .kind(EventKind.DELETION.getCode())
            .createdAt(createdAt)
            .content("")
            .tags(eventTags(activityId, tags))
            .build();
    }

    /**
     * Actor document to kind 0 metadata.
     */
    public NostrEvent fromActor(Map<String, Object> actor, long createdAt) {
        String name = string(actor, "name");
        String username = string(actor, "preferredUsername");
        Map<String, Object> icon = ActivityJson.asMap(actor.get("icon"));
        Map<String, Object> image = ActivityJson.asMap(actor.get("image"));
        String summary = string(actor, "summary");

        ProfileMetadata metadata = ProfileMetadata.builder()
            .name(username != null ? username : name)
            .displayName(name != null && !name.isBlank() ? name : username)
            .about(summary != null ? textTransform.htmlToMarkdown(summary) : null)
            .picture(icon != null ? idOf(icon.get("url")) : null)
            .banner(image != null ? idOf(image.get("url")) : null)
            .website(idOf(actor.get("url")))
            .build();
        try {
            return NostrEvent.builder()
                .kind(EventKind.METADATA.getCode())
                .createdAt(createdAt)
                .content(objectMapper.writeValueAsString(metadata))
                .tags(eventTags(string(actor, "id"), List.of()))
                .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize profile metadata", e);
        }
    }

    /**
     * Kind 3 follow list of a fediverse actor's derived key.
     */
    public NostrEvent followList(Collection<NativeIdentity> following, long createdAt) {
        List<List<String>> tags = following.stream()
            .map(identity -> List.of("p", identity.hex()))
            .collect(Collectors.toList());
        return NostrEvent.builder()
            .kind(EventKind.FOLLOW_LIST.getCode())
            .createdAt(createdAt)
            .content("")
            .tags(tags)
            .build();
    }

    /**
     * Parses kind 0 content; unknown fields are ignored.
     *
     * @return empty if the content is no JSON object
     */
    public Optional<ProfileMetadata> parseProfile(NostrEvent event) {
        try {
            return Optional.ofNullable(objectMapper.readValue(event.getContent(), ProfileMetadata.class));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable metadata in event {}", event.getId());
            return Optional.empty();
        }
    }

    // ==================== Helpers ====================

    /**
     * Tags every bridged event carries: the NIP-48 proxy tag pointing at the fediverse object
     * and a NIP-32 label in the bridge's namespace.
     */
    private List<List<String>> eventTags(String apId, List<List<String>> tags) {
        List<List<String>> result = new ArrayList<>(new LinkedHashSet<>(tags));
        String namespace = uris.labelNamespace();
        result.add(List.of("proxy", apId, "activitypub"));
        result.add(List.of("L", namespace));
        result.add(List.of("l", namespace + ".activitypub:" + apId, namespace));
        return result;
    }

    private String noteContent(Map<String, Object> note) {
        Map<String, Object> source = ActivityJson.asMap(note.get("source"));
        if (source != null && "text/x.misskeymarkdown".equals(string(source, "mediaType")) && string(source, "content") != null) {
            return string(source, "content");
        }
        String markdown = textTransform.htmlToMarkdown(string(note, "content"));
        return HASHTAG_LINK.matcher(markdown).replaceAll("$1");
    }

    private String replaceMentionLinks(String content, InboundContext ctx) {
        Matcher matcher = MENTION_LINK.matcher(content);
        StringBuilder sb = new StringBuilder(content.length());
        int last = 0;
        while (matcher.find()) {
            String key = resolveMentionLink(matcher, ctx);
            if (key == null) {
                continue;
            }
            String between = content.substring(last, matcher.start());
            if (last != 0 && !between.isEmpty() && isAsciiAlphanumeric(between.charAt(0))) {
                sb.append(' ');
            }
            sb.append(between).append("nostr:").append(NativeIdentity.fromHex(key).npub());
            last = matcher.end();
        }
        sb.append(content.substring(last));
        return sb.toString();
    }

    private String resolveMentionLink(Matcher matcher, InboundContext ctx) {
        String domain = matcher.group("domain");
        if (domain != null && domain.equalsIgnoreCase(uris.domain())) {
            try {
                return NativeIdentity.fromBech32(matcher.group("username")).hex();
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        String byUrl = ctx.getMentionKeys().get(matcher.group("url").trim());
        if (byUrl != null || domain == null) {
            return byUrl;
        }
        return ctx.getMentionKeys().get("@" + matcher.group("username") + "@" + domain.toLowerCase(Locale.ROOT));
    }

    private MediaSplit extractMedia(NostrEvent event, List<Degradation> degradations) {
        Map<String, Map<String, String>> imeta = parseImeta(event);
        String text = event.getContent() == null ? "" : event.getContent();

        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            urls.add(TRAILING_PUNCTUATION.matcher(matcher.group()).replaceAll(""));
        }
        urls.addAll(imeta.keySet());

        List<Map<String, Object>> attachments = new ArrayList<>();
        StringBuilder appended = new StringBuilder();
        for (String url : urls) {
            Map<String, String> meta = imeta.getOrDefault(url, Map.of());
            String mediaType = meta.containsKey("m") ? meta.get("m") : guessMediaType(url);
            if (mediaType != null && isSupportedMedia(mediaType)) {
                Map<String, Object> document = new LinkedHashMap<>();
                document.put("type", "Document");
                document.put("mediaType", mediaType);
                document.put("url", url);
                if (meta.containsKey("alt")) {
                    document.put("name", meta.get("alt"));
                }
                if (meta.containsKey("blurhash")) {
                    document.put("blurhash", meta.get("blurhash"));
                }
                attachments.add(document);
                text = text.replace(url, "");
            } else if (mediaType != null && imeta.containsKey(url)) {
                degradations.add(Degradation.of(Degradation.Reason.UNSUPPORTED_MEDIA, mediaType + " " + url));
                if (!text.contains(url)) {
                    appended.append('\n').append(url);
                }
            }
        }
        text = (text + appended)
            .replaceAll("[ \\t]+\\n", "\n")
            .replaceAll("\\n{3,}", "\n\n")
            .trim();
        return new MediaSplit(text, attachments);
    }

    private static Map<String, Map<String, String>> parseImeta(NostrEvent event) {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (List<String> tag : event.tags("imeta")) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (String entry : tag.subList(1, tag.size())) {
                int space = entry.indexOf(' ');
                if (space > 0) {
                    fields.put(entry.substring(0, space), entry.substring(space + 1));
                }
            }
            if (fields.containsKey("url")) {
                result.put(fields.get("url"), fields);
            }
        }
        return result;
    }

    private static String guessMediaType(String url) {
        String path = url;
        int query = indexOfAny(path, '?', '#');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) {
            return null;
        }
        return MEDIA_EXTENSIONS.get(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static boolean isSupportedMedia(String mediaType) {
        return mediaType.startsWith("image/") || mediaType.startsWith("video/") || mediaType.startsWith("audio/");
    }

    private List<Map<String, Object>> emojiTags(NostrEvent event) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (List<String> tag : event.tags("emoji")) {
            if (tag.size() < 3) {
                continue;
            }
            Map<String, Object> icon = new LinkedHashMap<>();
            icon.put("type", "Image");
            icon.put("url", tag.get(2));
            Map<String, Object> emoji = new LinkedHashMap<>();
            emoji.put("id", uris.baseUrl() + "/emojis/" + tag.get(1));
            emoji.put("type", "Emoji");
            emoji.put("name", ":" + tag.get(1) + ":");
            emoji.put("icon", icon);
            result.add(emoji);
        }
        return result;
    }

    private String mentionHtml(MentionTarget target) {
        String handle = target.getHandle();
        String local = handle.startsWith("@") ? handle.substring(1) : handle;
        int at = local.indexOf('@');
        if (at > 0) {
            local = local.substring(0, at);
        }
        return "<span class=\"h-card\"><a href=\"" + target.getActorUri()
            + "\" class=\"u-url mention\">@<span>" + local + "</span></a></span>";
    }

    private static Map<String, Object> proxyOf(String proxied) {
        Map<String, Object> proxy = new LinkedHashMap<>();
        proxy.put("protocol", NOSTR_PROTOCOL);
        proxy.put("proxied", proxied);
        proxy.put("authoritative", true);
        return proxy;
    }

    private static String followId(String actorUri, String targetUri) {
        byte[] hash = SchnorrSigner.sha256(targetUri.getBytes(StandardCharsets.UTF_8));
        return actorUri + "/follows/" + Bech32.toHex(hash).substring(0, 32);
    }

    private static Optional<String> markedEvent(List<List<String>> tags, String marker) {
        return tags.stream()
            .filter(tag -> tag.size() > 3 && marker.equals(tag.get(3)))
            .map(tag -> tag.get(1))
            .findFirst();
    }

    private static String attachmentUrl(Map<String, Object> attachment) {
        Object url = attachment.get("url");
        if (url instanceof List) {
            List<Object> links = ActivityJson.asList(url);
            return links.isEmpty() ? null : idOf(links.get(0));
        }
        return idOf(url);
    }

    private static long timestamp(String published, long fallback) {
        if (published == null) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(published).toEpochSecond();
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }

    private static String trimColons(String name) {
        String trimmed = name;
        while (trimmed.startsWith(":")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(":")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return c < 128 && Character.isLetterOrDigit(c);
    }

    private static int indexOfAny(String value, char... chars) {
        int result = -1;
        for (char c : chars) {
            int index = value.indexOf(c);
            if (index >= 0 && (result < 0 || index < result)) {
                result = index;
            }
        }
        return result;
    }

    private static class MediaSplit {
        private final String text;
        private final List<Map<String, Object>> attachments;

        MediaSplit(String text, List<Map<String, Object>> attachments) {
            this.text = text;
            this.attachments = attachments;
        }
    }
}
