package com.saurabhshcs.adtech.marketplace.api;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;
import java.util.Locale;
/** Accepts category query values in any case, e.g. {@code electronics} or {@code BOOKS}. */
@Component
public class ProductCategoryConverter implements Converter<String, ProductCategory> {
    @Override
    public ProductCategory convert(String source) {
        return ProductCategory.valueOf(source.trim().toUpperCase(Locale.ROOT));
    }
}
