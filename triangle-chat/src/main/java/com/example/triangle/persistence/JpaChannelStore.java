package com.example.triangle.persistence;

import com.example.triangle.config.ChatProperties;
import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.MessageQuery;
import com.example.triangle.domain.MessageType;
import com.example.triangle.domain.ParticipantRoster;
import com.example.triangle.domain.ReadPosition;
import com.example.triangle.service.ChannelStore;
import com.example.triangle.service.exception.AlreadyExistsException;
import com.example.triangle.service.exception.ChannelNotFoundException;
import com.example.triangle.service.exception.MessageNotFoundException;
import com.example.triangle.service.exception.ValidationException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
public class JpaChannelStore implements ChannelStore {

    private final ChannelJpaRepository channelRepository;
    private final MessageJpaRepository messageRepository;
    private final ReadPositionJpaRepository readPositionRepository;
    private final ChatEntityMapper mapper;
    private final ChatProperties chatProperties;
    private final Clock clock;
    private final TransactionTemplate transaction;
    private final TransactionTemplate isolatedTransaction;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaChannelStore(
            ChannelJpaRepository channelRepository,
            MessageJpaRepository messageRepository,
            ReadPositionJpaRepository readPositionRepository,
            ChatEntityMapper mapper,
            ChatProperties chatProperties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.channelRepository = channelRepository;
        this.messageRepository = messageRepository;
        this.readPositionRepository = readPositionRepository;
        this.mapper = mapper;
        this.chatProperties = chatProperties;
        this.clock = clock;
        this.transaction = new TransactionTemplate(transactionManager);
        this.isolatedTransaction = new TransactionTemplate(transactionManager);
        this.isolatedTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Channel> findChannel(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        return channelRepository.findByName(name).map(mapper::toChannel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Channel> listChannels() {
        return channelRepository.findAllByOrderByNameAsc().stream()
                .map(mapper::toChannel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Channel> listChannelsFor(String participant) {
        return channelRepository.findAll().stream()
                .map(mapper::toChannel)
                .filter(channel -> channel.hasParticipant(participant))
                .sorted((a, b) -> {
                    Instant left = a.getLastActivityAt();
                    Instant right = b.getLastActivityAt();
                    if (left == null && right == null) {
                        return a.getName().compareTo(b.getName());
                    }
                    if (left == null) {
                        return 1;
                    }
                    if (right == null) {
                        return -1;
                    }
                    return right.compareTo(left);
                })
                .toList();
    }

    @Override
    @Transactional
    public Channel createChannel(Channel channel) {
        if (channelRepository.findByName(channel.getName()).isPresent()) {
            throw new AlreadyExistsException("Channel already exists: " + channel.getName(), null);
        }
        Instant now = now();
        ChannelEntity entity = new ChannelEntity();
        entity.setId(UUID.randomUUID().toString());
        entity.setName(channel.getName());
        entity.setChannelType(channel.getType());
        entity.setParticipants(mapper.writeJson(channel.getParticipants()));
        entity.setDescription(channel.getDescription());
        entity.setLastSequence(0L);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        try {
            channelRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            throw new AlreadyExistsException("Channel already exists: " + channel.getName(), e);
        }
        return mapper.toChannel(entity);
    }

    @Override
    @Transactional
    public void touchChannel(String channelId, Instant activityAt) {
        channelRepository.updateLastActivity(channelId, activityAt);
    }

    @Override
    @Transactional
    public ChatMessage insertMessage(
            String channelId, String sender, String content, MessageType type, Map<String, Object> metadata) {
        // The row lock serializes appends to one channel until this transaction commits.
        ChannelEntity channel = channelRepository.lockById(channelId)
                .orElseThrow(() -> new ChannelNotFoundException(channelId));

        validateSender(mapper.toChannel(channel), sender, type);
        validateContent(content);

        long sequence = channel.getLastSequence() + 1;
        channel.setLastSequence(sequence);

        MessageEntity entity = new MessageEntity();
        entity.setId(UUID.randomUUID().toString());
        entity.setChannel(channel);
        entity.setSequence(sequence);
        entity.setSender(sender);
        entity.setContent(content);
        entity.setMessageType(type);
        entity.setMetadata(mapper.writeJson(metadata));
        entity.setDeleted(false);
        entity.setCreatedAt(now());
        messageRepository.save(entity);
        return mapper.toMessage(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findMessage(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return Optional.empty();
        }
        return messageRepository.findById(messageId).map(mapper::toMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> queryMessages(String channelId, MessageQuery query) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        var cq = cb.createQuery(MessageEntity.class);
        Root<MessageEntity> root = cq.from(MessageEntity.class);

        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("channel").get("id"), channelId));
        if (!query.isIncludeDeleted()) {
            predicates.add(cb.isFalse(root.get("deleted")));
        }
        if (query.getSince() != null) {
            predicates.add(cb.greaterThan(root.<Instant>get("createdAt"), query.getSince()));
        }
        if (query.getBefore() != null) {
            predicates.add(cb.lessThan(root.<Instant>get("createdAt"), query.getBefore()));
        }
        cq.where(cb.and(predicates.toArray(new Predicate[0])));

        // Newest first so the limit keeps the most recent window, then flipped back to chronological order.
        cq.orderBy(cb.desc(root.get("createdAt")), cb.desc(root.get("sequence")));

        TypedQuery<MessageEntity> typedQuery = entityManager.createQuery(cq);
        if (query.getLimit() != null) {
            typedQuery.setMaxResults(query.getLimit());
        }
        List<ChatMessage> messages = new ArrayList<>(typedQuery.getResultList().stream()
                .map(mapper::toMessage)
                .toList());
        Collections.reverse(messages);
        return messages;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findMessagesAfter(String channelId, Instant since) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        var cq = cb.createQuery(MessageEntity.class);
        Root<MessageEntity> root = cq.from(MessageEntity.class);
        cq.where(unreadPredicate(cb, root, channelId, since));
        cq.orderBy(cb.asc(root.get("createdAt")), cb.asc(root.get("sequence")));
        return entityManager.createQuery(cq).getResultList().stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countMessagesAfter(String channelId, Instant since) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        var cq = cb.createQuery(Long.class);
        Root<MessageEntity> root = cq.from(MessageEntity.class);
        cq.select(cb.count(root));
        cq.where(unreadPredicate(cb, root, channelId, since));
        return entityManager.createQuery(cq).getSingleResult();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findLatestMessage(String channelId) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        var cq = cb.createQuery(MessageEntity.class);
        Root<MessageEntity> root = cq.from(MessageEntity.class);
        cq.where(unreadPredicate(cb, root, channelId, null));
        cq.orderBy(cb.desc(root.get("createdAt")), cb.desc(root.get("sequence")));
        return entityManager.createQuery(cq)
                .setMaxResults(1)
                .getResultList()
                .stream()
                .findFirst()
                .map(mapper::toMessage);
    }

    @Override
    @Transactional
    public ChatMessage editMessage(String messageId, String content, Instant editedAt) {
        MessageEntity entity = messageRepository.findById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        if (entity.isDeleted()) {
            throw new ValidationException("messageId", "refers to a deleted message");
        }
        validateContent(content);
        entity.setContent(content);
        entity.setEditedAt(editedAt);
        return mapper.toMessage(entity);
    }

    @Override
    @Transactional
    public ChatMessage softDeleteMessage(String messageId) {
        MessageEntity entity = messageRepository.findById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        entity.setDeleted(true);
        return mapper.toMessage(entity);
    }

    @Override
    public ReadPosition getOrCreateReadPosition(String channelId, String participant) {
        Optional<ReadPosition> existing = findReadPosition(channelId, participant);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return isolatedTransaction.execute(status -> insertReadPosition(channelId, participant));
        } catch (DataIntegrityViolationException e) {
            log.debug("Read position for {} in channel {} was created concurrently", participant, channelId);
            return findReadPosition(channelId, participant)
                    .orElseThrow(() -> new IllegalStateException(
                            "Read position vanished after concurrent creation", e));
        }
    }

    @Override
    public ReadPosition advanceReadPosition(String channelId, String participant, Instant readAt, String messageId) {
        getOrCreateReadPosition(channelId, participant);
        return transaction.execute(status -> {
            int updated = readPositionRepository.advance(channelId, participant, readAt, messageId, now());
            if (updated == 0) {
                log.debug("Read position of {} in channel {} already at or past {}", participant, channelId, readAt);
            }
            return readPositionRepository.findByChannel_IdAndParticipant(channelId, participant)
                    .map(mapper::toReadPosition)
                    .orElseThrow(() -> new IllegalStateException("Read position missing after update"));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Instant> findReadPositions(String participant) {
        Map<String, Instant> positions = new TreeMap<>();
        for (ReadPositionEntity entity : readPositionRepository.findAllForParticipant(participant)) {
            positions.put(entity.getChannel().getName(), entity.getLastReadAt());
        }
        return positions;
    }

    private Optional<ReadPosition> findReadPosition(String channelId, String participant) {
        return transaction.execute(status -> readPositionRepository
                .findByChannel_IdAndParticipant(channelId, participant)
                .map(mapper::toReadPosition));
    }

    private ReadPosition insertReadPosition(String channelId, String participant) {
        ChannelEntity channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new ChannelNotFoundException(channelId));
        Instant now = now();
        ReadPositionEntity entity = new ReadPositionEntity();
        entity.setId(UUID.randomUUID().toString());
        entity.setChannel(channel);
        entity.setParticipant(participant);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        readPositionRepository.saveAndFlush(entity);
        return mapper.toReadPosition(entity);
    }

    private Predicate unreadPredicate(CriteriaBuilder cb, Root<MessageEntity> root, String channelId, Instant since) {
        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("channel").get("id"), channelId));
        predicates.add(cb.isFalse(root.get("deleted")));
        if (since != null) {
            predicates.add(cb.greaterThan(root.<Instant>get("createdAt"), since));
        }
        return cb.and(predicates.toArray(new Predicate[0]));
    }

    private void validateSender(Channel channel, String sender, MessageType type) {
        if (type == null) {
            throw new ValidationException("type", "is required");
        }
        if (ParticipantRoster.SYSTEM_SENDER.equals(sender)) {
            if (type != MessageType.SYSTEM) {
                throw new ValidationException("type", "must be system for the system sender");
            }
            return;
        }
        if (!channel.hasParticipant(sender)) {
            throw new ValidationException("sender", "is not a participant of channel " + channel.getName());
        }
    }

    private void validateContent(String content) {
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("content", "must not be blank");
        }
        int maxLength = chatProperties.getMessages().getMaxContentLength();
        if (content.codePointCount(0, content.length()) > maxLength) {
            throw new ValidationException("content", "must be at most %d characters".formatted(maxLength));
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
