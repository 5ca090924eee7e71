package com.ryuqq.mediator.core.request;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AbstractCommand 식별자 부여 테스트.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
class AbstractCommandTest {

    static final class RenameCustomer extends AbstractCommand<String> {
        private final String name;

        RenameCustomer(String name) {
            this.name = name;
        }

        RenameCustomer(CommandId id, String name) {
            super(id);
            this.name = name;
        }
    }

    record ArchiveCustomer(CommandId id, String customerId) implements Command<Boolean> {
        ArchiveCustomer(String customerId) {
            this(CommandId.generate(), customerId);
        }
    }

    @Test
    void id_생성_시점에_한번_부여되고_재조회해도_동일() {
        // given
        RenameCustomer command = new RenameCustomer("kim");

        // when
        CommandId first = command.id();
        CommandId second = command.id();

        // then
        assertThat(first).isNotNull().isEqualTo(second);
    }

    @Test
    void id_인스턴스마다_다름() {
        assertThat(new RenameCustomer("a").id()).isNotEqualTo(new RenameCustomer("a").id());
    }

    @Test
    void id_지정_생성() {
        CommandId id = CommandId.generate();

        assertThat(new RenameCustomer(id, "a").id()).isEqualTo(id);
    }

    @Test
    void id_null_거부() {
        assertThatThrownBy(() -> new RenameCustomer(null, "a"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("id cannot be null");
    }

    @Test
    void record_Command_편의_생성자로_식별자_부여() {
        // given
        ArchiveCustomer command = new ArchiveCustomer("c-1");

        // then
        assertThat(command.id()).isNotNull().isEqualTo(command.id());
        assertThat(new ArchiveCustomer("c-1").id()).isNotEqualTo(command.id());
    }

    @Test
    void toString_클래스명과_식별자_포함() {
        RenameCustomer command = new RenameCustomer("a");

        assertThat(command.toString()).startsWith("RenameCustomer{").contains(command.id().toString());
    }
}
