package com.ryuqq.smokestack.adapter.runner.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ryuqq.smokestack.core.model.Component;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.SubscriptionSet;
import com.ryuqq.smokestack.core.model.Tag;
import com.ryuqq.smokestack.core.model.User;
import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;
import com.ryuqq.smokestack.core.spi.SnapshotCodec;
import com.ryuqq.smokestack.core.statemachine.OperationState;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Jackson 기반 JSON 스냅샷 codec.
 *
 * <p><strong>문서 형식:</strong></p>
 * <pre>
 * {
 *   "nextId": 1236,
 *   "users": [{"name": "alice", "subscriptions": {"operations": [1234], "components": ["db"], "tags": []}}],
 *   "operations": [{"id": 1234, "title": "...", "url": "https://...", "status": "in_progress", ...}],
 *   "components": [{"name": "db", "description": "...", "owners": ["alice"]}],
 *   "tags": [{"name": "urgent", "description": "..."}]
 * }
 * </pre>
 *
 * <p>Operation의 url은 문자열, status는 wire name으로 저장합니다.
 * 알 수 없는 필드는 무시하고, 알 수 없는 status나 잘못된 url은 {@link IOException}으로 보고합니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class JsonSnapshotCodec implements SnapshotCodec {

    private final ObjectMapper objectMapper;

    public JsonSnapshotCodec() {
        this(false);
    }

    /**
     * 생성자.
     *
     * @param prettyPrint 들여쓰기 출력 여부
     */
    public JsonSnapshotCodec(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    @Override
    public byte[] encode(EntitySnapshot snapshot) throws IOException {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        return objectMapper.writeValueAsBytes(SnapshotDocument.from(snapshot));
    }

    @Override
    public EntitySnapshot decode(byte[] blob) throws IOException {
        if (blob == null) {
            throw new IllegalArgumentException("blob cannot be null");
        }
        SnapshotDocument document = objectMapper.readValue(blob, SnapshotDocument.class);
        try {
            return document.toSnapshot();
        } catch (IllegalArgumentException e) {
            throw new IOException("malformed snapshot: " + e.getMessage(), e);
        }
    }

    record SnapshotDocument(
        long nextId,
        List<UserDocument> users,
        List<OperationDocument> operations,
        List<ComponentDocument> components,
        List<TagDocument> tags
    ) {

        static SnapshotDocument from(EntitySnapshot snapshot) {
            return new SnapshotDocument(
                snapshot.nextId(),
                snapshot.users().stream().map(UserDocument::from).collect(Collectors.toList()),
                snapshot.operations().stream().map(OperationDocument::from).collect(Collectors.toList()),
                snapshot.components().stream().map(ComponentDocument::from).collect(Collectors.toList()),
                snapshot.tags().stream().map(TagDocument::from).collect(Collectors.toList())
            );
        }

        EntitySnapshot toSnapshot() {
            return new EntitySnapshot(
                nextId,
                orEmpty(users).stream().map(UserDocument::toUser).collect(Collectors.toList()),
                orEmpty(operations).stream().map(OperationDocument::toOperation).collect(Collectors.toList()),
                orEmpty(components).stream().map(ComponentDocument::toComponent).collect(Collectors.toList()),
                orEmpty(tags).stream().map(TagDocument::toTag).collect(Collectors.toList())
            );
        }
    }

    record UserDocument(String name, SubscriptionDocument subscriptions) {

        static UserDocument from(User user) {
            SubscriptionSet subscriptions = user.subscriptions();
            return new UserDocument(user.name(), new SubscriptionDocument(
                List.copyOf(subscriptions.operations()),
                List.copyOf(subscriptions.components()),
                List.copyOf(subscriptions.tags())
            ));
        }

        User toUser() {
            SubscriptionSet set = subscriptions == null
                ? SubscriptionSet.empty()
                : new SubscriptionSet(
                    new TreeSet<>(orEmpty(subscriptions.operations())),
                    new TreeSet<>(orEmpty(subscriptions.components())),
                    new TreeSet<>(orEmpty(subscriptions.tags())));
            return new User(name, set);
        }
    }

    record SubscriptionDocument(List<Long> operations, List<String> components, List<String> tags) {
    }

    record OperationDocument(
        long id,
        String title,
        String purpose,
        String url,
        List<String> components,
        List<String> locks,
        List<String> tags,
        List<Long> dependsOn,
        List<String> operators,
        String status,
        Map<String, String> annotations
    ) {

        static OperationDocument from(Operation operation) {
            return new OperationDocument(
                operation.id(), operation.title(), operation.purpose(),
                operation.url() == null ? null : operation.url().toString(),
                operation.components(), operation.locks(), operation.tags(), operation.dependsOn(),
                operation.operators(), operation.status().wireName(), operation.annotations()
            );
        }

        Operation toOperation() {
            if (status == null) {
                throw new IllegalArgumentException("operation " + id + " has no status");
            }
            return new Operation(id, title, purpose, url == null ? null : URI.create(url),
                components, locks, tags, dependsOn, operators, OperationState.fromWireName(status), annotations);
        }
    }

    record ComponentDocument(String name, String description, List<String> owners) {

        static ComponentDocument from(Component component) {
            return new ComponentDocument(component.name(), component.description(), component.owners());
        }

        Component toComponent() {
            return new Component(name, description, owners);
        }
    }

    record TagDocument(String name, String description) {

        static TagDocument from(Tag tag) {
            return new TagDocument(tag.name(), tag.description());
        }

        Tag toTag() {
            return new Tag(name, description);
        }
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
