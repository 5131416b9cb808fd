package org.kleis.verify.solvers.z3;

import com.microsoft.z3.Context;
import org.kleis.verify.solvers.ConversionException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class Z3ResultConverterTest {

    private Context ctx;
    private Z3ResultConverter converter;

    @BeforeAll
    void setUpContext() {
        ctx = new Context();
    }

    @AfterAll
    void tearDown() {
        ctx.close();
    }

    @BeforeEach
    void setUp() {
        converter = new Z3ResultConverter();
    }

    @Nested
    @DisplayName("整数提取 (toLong)")
    class ToLongTests {

        @Test
        @DisplayName("整数与分母为 1 的有理数")
        void testToLong_Integers() {
            assertAll("Integer values",
                    () -> assertEquals(42L, converter.toLong(ctx.mkInt(42))),
                    () -> assertEquals(-7L, converter.toLong(ctx.mkInt(-7))),
                    () -> assertEquals(6L, converter.toLong(ctx.mkReal(6))),
                    () -> assertEquals(Long.MAX_VALUE, converter.toLong(ctx.mkInt(Long.toString(Long.MAX_VALUE))))
            );
        }

        @Test
        @DisplayName("超出 long 范围的整数应抛出 ConversionException")
        void testToLong_Overflow_ShouldThrowConversionException() {
            ConversionException e = assertThrows(ConversionException.class,
                    () -> converter.toLong(ctx.mkInt("123456789012345678901234567890")));
            assertInstanceOf(ArithmeticException.class, e.getCause());
        }

        @Test
        @DisplayName("超出 long 范围的有理数应抛出 ConversionException")
        void testToLong_RationalOverflow_ShouldThrowConversionException() {
            assertThrows(ConversionException.class,
                    () -> converter.toLong(ctx.mkReal("123456789012345678901234567890")));
        }

        @Test
        @DisplayName("非整数值应抛出 ConversionException")
        void testToLong_NotInteger_ShouldThrowConversionException() {
            assertAll("Non-integers",
                    () -> assertThrows(ConversionException.class, () -> converter.toLong(ctx.mkReal(1, 2))),
                    () -> assertThrows(ConversionException.class, () -> converter.toLong(ctx.mkTrue()))
            );
        }
    }

    @Nested
    @DisplayName("布尔与浮点提取 (toBoolean, toDouble)")
    class OtherScalarTests {

        @Test
        @DisplayName("布尔字面量")
        void testToBoolean() {
            assertTrue(converter.toBoolean(ctx.mkTrue()));
            assertFalse(converter.toBoolean(ctx.mkFalse()));
            assertThrows(ConversionException.class, () -> converter.toBoolean(ctx.mkInt(1)));
        }

        @Test
        @DisplayName("整数与有理数转为 double")
        void testToDouble() {
            assertAll("Doubles",
                    () -> assertEquals(3.0, converter.toDouble(ctx.mkInt(3)), 1e-12),
                    () -> assertEquals(0.5, converter.toDouble(ctx.mkReal(1, 2)), 1e-12),
                    () -> assertThrows(ConversionException.class, () -> converter.toDouble(ctx.mkFalse()))
            );
        }
    }
}
