package com.ai.salesbot.service;

import com.ai.salesbot.entity.Product;
import com.ai.salesbot.exception.NotFoundException;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.repository.ProductRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Service
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository repository;

    public ProductService(ProductRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Product getActive() {
        return repository.findFirstByActiveTrueOrderByUpdatedAtDesc()
                .orElseThrow(() -> new NotFoundException("No active product"));
    }

    /**
     * Makes {@code id} the only active product in a single statement.
     */
    @Transactional
    public Product activate(Long id) {
        if (!repository.existsById(id)) {
            throw NotFoundException.of("Product", id);
        }
        repository.activateExclusively(id, Instant.now());
        log.info("Product activated | id={}", id);
        return repository.findById(id).orElseThrow(() -> NotFoundException.of("Product", id));
    }

    @Transactional(readOnly = true)
    public List<Product> list() {
        return repository.findAll();
    }

    @Transactional
    public Product create(Product product) {
        if (StringUtils.isBlank(product.getName())) throw new ValidationException("name is required");
        product.setActive(false);
        return repository.save(product);
    }
}
