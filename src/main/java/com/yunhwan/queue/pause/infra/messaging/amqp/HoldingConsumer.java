package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 큐를 멈추기 위한 blocking consumer.
 * <p>
 * manual-ack + prefetch=1 로 등록되고, 받은 메시지를 ack/nack/reject 하지 않는다.
 * 브로커는 unacked 1건을 가진 이 consumer에게 더 이상 전달하지 않는다.
 * 브로커가 consumer를 끊으면(큐 삭제, 채널/연결 종료) {@link LossListener}에 알린다.
 */
@Slf4j
class HoldingConsumer extends DefaultConsumer {

    interface LossListener {
        void consumerLost(String consumerTag, String reason);
    }

    private final String queueName;
    private final LossListener lossListener;

    // delivery tag는 channel 범위 → multiple=true nack 금지, 건별로만 반환
    private final Queue<Long> heldDeliveryTags = new ConcurrentLinkedQueue<>();

    // cancel-ok 는 dispatcher 에서 앞선 delivery 콜백이 모두 끝난 뒤에 온다
    private final CountDownLatch cancelOk = new CountDownLatch(1);
    private volatile boolean released = false;

    HoldingConsumer(Channel channel, String queueName, LossListener lossListener) {
        super(channel);
        this.queueName = queueName;
        this.lossListener = lossListener;
    }

    String queueName() {
        return queueName;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        if (released) {
            // resume 이 끝난 뒤 늦게 도착한 delivery → 붙잡지 않고 바로 돌려준다
            requeue(envelope.getDeliveryTag());
            return;
        }
        // ack 하지 않음: 이 1건이 in-flight 슬롯을 점유한다
        heldDeliveryTags.add(envelope.getDeliveryTag());
        log.debug("[HoldingConsumer] holding delivery without ack. queue={}, consumerTag={}, deliveryTag={}, redeliver={}",
                queueName, consumerTag, envelope.getDeliveryTag(), envelope.isRedeliver());
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        super.handleCancelOk(consumerTag);
        cancelOk.countDown();
    }

    @Override
    public void handleCancel(String consumerTag) {
        // 우리가 basic.cancel 한 경우가 아니라 브로커가 끊은 경우 (예: 큐 삭제)
        lossListener.consumerLost(consumerTag, "cancelled by broker");
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        lossListener.consumerLost(consumerTag, sig == null ? "channel shutdown" : sig.getMessage());
    }

    /**
     * basic.cancel 이후 dispatcher 가 cancel-ok 를 처리할 때까지 기다린다.
     * 그 전에 큐에 쌓여 있던 delivery 콜백은 이 시점까지 모두 실행된다.
     *
     * @return 제한 시간 안에 cancel-ok 를 받았는지
     */
    boolean awaitCancelOk(Duration timeout) {
        try {
            return cancelOk.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    List<Long> heldDeliveryTags() {
        return new ArrayList<>(heldDeliveryTags);
    }

    /**
     * basic.cancel 만으로는 unacked 메시지가 채널에 남는다.
     * 건별로 nack(requeue=true) 해서 다른 consumer에게 재전달되게 한다.
     * 채널이 이미 닫혔다면 브로커가 알아서 requeue 하므로 로그만 남긴다.
     */
    int releaseHeldDeliveries() {
        released = true;
        int count = 0;
        Long tag;
        while ((tag = heldDeliveryTags.poll()) != null) {
            if (requeue(tag)) {
                count++;
            }
        }
        return count;
    }

    private boolean requeue(long deliveryTag) {
        try {
            getChannel().basicNack(deliveryTag, false, true);
            return true;
        } catch (IOException | AlreadyClosedException e) {
            log.warn("[HoldingConsumer] requeue skipped (channel closing requeues it). queue={}, deliveryTag={}, err={}",
                    queueName, deliveryTag, e.toString());
            return false;
        }
    }
}
